package com.example.environment_service.exception;

import lombok.Getter;

/**
 * Base exception for all environment-service failures.
 * Carries the {@link ErrorKind} and the identity the failure applies to, so callers
 * can tell a single sandbox failure apart from a rejected request.
 */
@Getter
public class EnvironmentException extends RuntimeException {

    private final ErrorKind errorKind;
    private final String identity;

    /**
     * Creates a new EnvironmentException.
     *
     * @param errorKind the failure classification
     * @param identity  the environment or batch identity, may be {@code null}
     * @param message   the detail message
     */
    public EnvironmentException(ErrorKind errorKind, String identity, String message) {
        super(message);
        this.errorKind = errorKind;
        this.identity = identity;
    }

    /**
     * Creates a new EnvironmentException with a root cause.
     *
     * @param errorKind the failure classification
     * @param identity  the environment or batch identity, may be {@code null}
     * @param message   the detail message
     * @param cause     the root cause
     */
    public EnvironmentException(ErrorKind errorKind, String identity, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.identity = identity;
    }
}
