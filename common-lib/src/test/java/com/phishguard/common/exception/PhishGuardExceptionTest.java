package com.phishguard.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhishGuardExceptionTest {

    @Test
    @DisplayName("message is prefixed with the raising component")
    void componentPrefix() {
        PhishGuardException e = new PhishGuardException("ScoringService", "remote model gave no score");

        assertEquals("ScoringService", e.getComponent());
        assertEquals("[ScoringService] remote model gave no score", e.getMessage());
    }

    @Test
    @DisplayName("cause is kept")
    void keepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        assertSame(cause, new PhishGuardException("HistoryService", "save failed", cause).getCause());
    }

    @Test
    @DisplayName("invalid input keeps the bare user message apart from the prefixed one")
    void invalidInputUserMessage() {
        InvalidInputException e = new InvalidInputException("HistoryService", "Score must be between 0 and 100.");

        assertEquals("Score must be between 0 and 100.", e.getUserMessage());
        assertEquals("[HistoryService] Score must be between 0 and 100.", e.getMessage());
        assertInstanceOf(PhishGuardException.class, e);
    }
}
