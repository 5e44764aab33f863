package com.phishguard.common.exception;

/**
 * Base of all PhishGuard failures. The message is prefixed with the component
 * that raised it, e.g. {@code "[ScoringService] ..."}.
 */
public class PhishGuardException extends RuntimeException {
    private final String component;

    public PhishGuardException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public PhishGuardException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
