package com.example.environment_service.exception;

/**
 * Thrown when an action is not legal for the environment's current state.
 */
public class IllegalTransitionException extends EnvironmentException {

    public IllegalTransitionException(String identity, String message) {
        super(ErrorKind.ILLEGAL_TRANSITION, identity, message);
    }
}
