package com.example.environment_service.model;

/**
 * Quota pressure classification, ordered from lowest to highest.
 */
public enum PressureLevel {
    NORMAL,
    WARNING,
    CRITICAL;

    public PressureLevel max(PressureLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
