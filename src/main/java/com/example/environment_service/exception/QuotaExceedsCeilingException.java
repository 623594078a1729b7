package com.example.environment_service.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a resolved quota dimension is above the global ceiling.
 * The request is rejected outright, values are never clamped.
 */
@Getter
public class QuotaExceedsCeilingException extends EnvironmentException {

    private final List<String> dimensions;

    public QuotaExceedsCeilingException(String identity, List<String> dimensions) {
        super(ErrorKind.QUOTA_EXCEEDS_CEILING, identity,
                "Requested quota exceeds the global ceiling for: " + String.join(", ", dimensions));
        this.dimensions = List.copyOf(dimensions);
    }
}
