package com.example.environment_service.model;

public enum EnvironmentAction {
    START,
    STOP,
    RESTART,
    DELETE
}
