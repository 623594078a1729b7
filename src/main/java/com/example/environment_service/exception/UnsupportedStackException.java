package com.example.environment_service.exception;

/**
 * Thrown when a language, version or framework is missing from the supported stack matrix.
 */
public class UnsupportedStackException extends EnvironmentException {

    public UnsupportedStackException(String identity, String message) {
        super(ErrorKind.UNSUPPORTED_STACK, identity, message);
    }
}
