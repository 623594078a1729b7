package com.example.environment_service.exception;

/**
 * Thrown when a request is malformed. Never retried.
 */
public class ValidationException extends EnvironmentException {

    public ValidationException(String identity, String message) {
        super(ErrorKind.VALIDATION, identity, message);
    }
}
