package com.phishguard.analysis.controller;

import com.phishguard.common.exception.InvalidInputException;
import com.phishguard.common.exception.PhishGuardException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> invalidInput(InvalidInputException e) {
        log.info("Rejected request. component={} reason={}", e.getComponent(), e.getUserMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getUserMessage()));
    }

    @ExceptionHandler(PhishGuardException.class)
    public ResponseEntity<Map<String, String>> failure(PhishGuardException e) {
        log.error("Analysis failed. component={}", e.getComponent(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", "Analysis failed. Please try again."));
    }
}
