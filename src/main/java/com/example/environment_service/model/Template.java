package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reusable environment blueprint. Immutable while any non-deleted environment references it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Template {
    private String id;
    private String name;
    private int version;
    private String baseImage;
    private StackConfig stack;
    private QuotaPolicy defaultLimits;
    private Instant createdAt;
    private Instant updatedAt;
}
