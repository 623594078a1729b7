package com.example.environment_service.dto;

public enum BatchOperation {
    CREATE,
    DELETE
}
