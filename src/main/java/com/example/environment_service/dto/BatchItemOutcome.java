package com.example.environment_service.dto;

public enum BatchItemOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED,
    DELETABLE,
    NOT_DELETABLE
}
