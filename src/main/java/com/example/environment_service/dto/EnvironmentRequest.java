package com.example.environment_service.dto;

import com.example.environment_service.model.QuotaOverrides;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request to provision one environment.
 * {@code identity} drives every derived cluster name; it defaults to {@code userId}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentRequest {
    private String identity;
    private String userId;
    private String templateId;
    private String gitRepository;
    private String gitBranch;
    private QuotaOverrides quotaOverrides;
    private Long ttlSeconds;
    private Map<String, String> environmentVariables;
    private boolean awaitReady;
}
