package com.example.environment_service.exception;

/**
 * Failure reported by the cluster adapter. Only {@link ErrorKind#ADAPTER_TRANSIENT}
 * is retried by the engine; a conflict is the authoritative name-collision signal.
 */
public class AdapterException extends EnvironmentException {

    public AdapterException(ErrorKind errorKind, String identity, String message) {
        super(requireAdapterKind(errorKind), identity, message);
    }

    public AdapterException(ErrorKind errorKind, String identity, String message, Throwable cause) {
        super(requireAdapterKind(errorKind), identity, message, cause);
    }

    public static AdapterException transientError(String identity, String message, Throwable cause) {
        return new AdapterException(ErrorKind.ADAPTER_TRANSIENT, identity, message, cause);
    }

    public static AdapterException conflict(String identity, String message) {
        return new AdapterException(ErrorKind.ADAPTER_CONFLICT, identity, message);
    }

    public static AdapterException notFound(String identity, String message) {
        return new AdapterException(ErrorKind.ADAPTER_NOT_FOUND, identity, message);
    }

    public static AdapterException rejected(String identity, String message) {
        return new AdapterException(ErrorKind.ADAPTER_REJECTED, identity, message);
    }

    public boolean isTransient() {
        return getErrorKind() == ErrorKind.ADAPTER_TRANSIENT;
    }

    public boolean isNotFound() {
        return getErrorKind() == ErrorKind.ADAPTER_NOT_FOUND;
    }

    private static ErrorKind requireAdapterKind(ErrorKind errorKind) {
        switch (errorKind) {
            case ADAPTER_TRANSIENT:
            case ADAPTER_CONFLICT:
            case ADAPTER_NOT_FOUND:
            case ADAPTER_REJECTED:
                return errorKind;
            default:
                throw new IllegalArgumentException("Not an adapter error kind: " + errorKind);
        }
    }
}
