package com.example.environment_service.dto;

public enum BatchMode {
    APPLY,
    DRY_RUN
}
