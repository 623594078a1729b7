package com.example.environment_service.exception;

/**
 * Thrown when an environment or template record does not exist.
 */
public class NotFoundException extends EnvironmentException {

    public NotFoundException(String identity, String message) {
        super(ErrorKind.NOT_FOUND, identity, message);
    }
}
