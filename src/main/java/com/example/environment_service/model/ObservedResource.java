package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Status of a single cluster object as read through the adapter.
 * Fields that do not apply to a kind are left at their defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedResource {
    private ResourceKind kind;
    private String namespace;
    private String name;
    private String phase;
    private int readyReplicas;
    private int desiredReplicas;
    private QuotaUsage quotaUsed;
    private Map<String, String> labels;
    private Instant createdAt;
    private boolean terminating;
}
