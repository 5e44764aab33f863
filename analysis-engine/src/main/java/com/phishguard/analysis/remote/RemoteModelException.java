package com.phishguard.analysis.remote;

import com.phishguard.common.exception.PhishGuardException;

/**
 * The remote model answered with something that is not a usable verdict.
 * Always recovered by falling back to the local pipeline.
 */
public class RemoteModelException extends PhishGuardException {

    public RemoteModelException(String message) {
        super("RemoteModel", message);
    }

    public RemoteModelException(String message, Throwable cause) {
        super("RemoteModel", message, cause);
    }
}
