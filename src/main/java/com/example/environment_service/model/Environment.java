package com.example.environment_service.model;

import com.example.environment_service.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One provisioned sandbox: namespace, quota, workload and network entry point.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Environment {
    private String id;
    private String identity;
    private String userId;
    private String namespace;
    private String templateId;
    private int templateVersion;
    private GitSource gitSource;
    private QuotaPolicy quota;
    private List<Integer> exposedPorts;
    private Map<String, String> environmentVariables;
    private String image;
    private String accessUrl;

    private EnvironmentState state;
    private String statusMessage;
    private ErrorKind lastErrorKind;

    private Instant createdAt;
    private Instant provisioningStartedAt;
    private Instant updatedAt;
    private Instant expiresAt;

    public boolean isActive() {
        return state != null && !state.isTerminal();
    }
}
