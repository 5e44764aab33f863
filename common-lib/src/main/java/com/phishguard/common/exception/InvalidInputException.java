package com.phishguard.common.exception;

/**
 * Raised at service boundaries when a request carries nothing to analyze.
 * The scoring core itself never throws this; it scores empty text as zero.
 */
public class InvalidInputException extends PhishGuardException {

    private final String userMessage;

    public InvalidInputException(String component, String userMessage) {
        super(component, userMessage);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
