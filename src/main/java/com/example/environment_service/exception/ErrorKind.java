package com.example.environment_service.exception;

/**
 * Machine-readable classification carried by every {@link EnvironmentException}
 * and by failed batch items.
 */
public enum ErrorKind {
    VALIDATION,
    QUOTA_EXCEEDS_CEILING,
    UNSUPPORTED_STACK,
    ADAPTER_TRANSIENT,
    ADAPTER_CONFLICT,
    ADAPTER_NOT_FOUND,
    ADAPTER_REJECTED,
    PARTIAL_PROVISIONING,
    ILLEGAL_TRANSITION,
    NOT_FOUND,
    BATCH_TOO_LARGE,
    TEMPLATE_IN_USE,
    TIMEOUT,
    INTERNAL
}
