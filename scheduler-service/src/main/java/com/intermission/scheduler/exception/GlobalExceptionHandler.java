package com.intermission.scheduler.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(AdmissionUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleUnavailable(AdmissionUnavailableException ex) {

        return Map.of(
                "timestamp", Instant.now().toString(),
                "operation", ex.getOperation(),
                "status", "ADMISSION_UNAVAILABLE",
                "message", ex.getMessage()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {

        return Map.of(
                "timestamp", Instant.now().toString(),
                "status", "BAD_REQUEST",
                "message", ex.getMessage()
        );
    }
}
