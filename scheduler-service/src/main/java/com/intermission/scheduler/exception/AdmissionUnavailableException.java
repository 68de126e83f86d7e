package com.intermission.scheduler.exception;

import lombok.Getter;

/**
 * The admission loop could not run a request (shut down, interrupted or too slow).
 */
@Getter
public class AdmissionUnavailableException extends RuntimeException {

    private final String operation;

    public AdmissionUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }
}
