package com.example.environment_service.dto;

import com.example.environment_service.model.PressureLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceAlert {

    public enum Category {
        EXPIRATION,
        ENVIRONMENT_FAILED,
        QUOTA_PRESSURE
    }

    private Category category;
    private PressureLevel severity;
    private String environmentId;
    private String namespace;
    private String message;
    private Instant expiresAt;
}
