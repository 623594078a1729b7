package com.example.environment_service.service;

import com.example.environment_service.adapter.ClusterAdapter;
import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.dto.ResourceAlert;
import com.example.environment_service.exception.AdapterException;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentState;
import com.example.environment_service.model.ObservedResource;
import com.example.environment_service.model.PressureLevel;
import com.example.environment_service.model.PressureReport;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.repository.EnvironmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects operator alerts: environments about to expire, failed environments and quota pressure.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResourceAlertService {

    private final EnvironmentRepository environmentRepository;
    private final ClusterAdapter clusterAdapter;
    private final QuotaGovernor quotaGovernor;
    private final OrchestrationProperties properties;

    public List<ResourceAlert> collect(Instant now) {
        Instant warnBefore = now.plus(properties.getPressure().getExpiryWarningWindow());
        List<ResourceAlert> alerts = new ArrayList<>();

        List<Environment> environments = new ArrayList<>(environmentRepository.findAll());
        environments.sort(Comparator.comparing(Environment::getNamespace, Comparator.nullsLast(Comparator.naturalOrder())));

        for (Environment environment : environments) {
            EnvironmentState state = environment.getState();

            if (state == EnvironmentState.RUNNING && environment.getExpiresAt() != null
                    && environment.getExpiresAt().isAfter(now) && !environment.getExpiresAt().isAfter(warnBefore)) {
                alerts.add(ResourceAlert.builder()
                        .category(ResourceAlert.Category.EXPIRATION)
                        .severity(PressureLevel.WARNING)
                        .environmentId(environment.getId())
                        .namespace(environment.getNamespace())
                        .message("Environment " + environment.getIdentity() + " expires at " + environment.getExpiresAt())
                        .expiresAt(environment.getExpiresAt())
                        .build());
            }

            if (state == EnvironmentState.FAILED) {
                alerts.add(ResourceAlert.builder()
                        .category(ResourceAlert.Category.ENVIRONMENT_FAILED)
                        .severity(PressureLevel.CRITICAL)
                        .environmentId(environment.getId())
                        .namespace(environment.getNamespace())
                        .message("Environment " + environment.getIdentity() + " failed: " + environment.getStatusMessage())
                        .expiresAt(environment.getExpiresAt())
                        .build());
            }

            if (state == EnvironmentState.RUNNING || state == EnvironmentState.DEGRADED) {
                PressureReport report = pressure(environment);
                if (report != null && report.getOverall() != PressureLevel.NORMAL) {
                    alerts.add(ResourceAlert.builder()
                            .category(ResourceAlert.Category.QUOTA_PRESSURE)
                            .severity(report.getOverall())
                            .environmentId(environment.getId())
                            .namespace(environment.getNamespace())
                            .message(String.format("Quota pressure on %s: cpu %.0f%%, memory %.0f%%, pods %.0f%%",
                                    environment.getIdentity(), report.getCpuRatio() * 100,
                                    report.getMemoryRatio() * 100, report.getPodsRatio() * 100))
                            .expiresAt(environment.getExpiresAt())
                            .build());
                }
            }
        }

        log.info("🔔 Collected {} alert(s)", alerts.size());
        return alerts;
    }

    /**
     * @return the pressure report for the environment, or {@code null} when its quota cannot be read
     */
    public PressureReport pressure(Environment environment) {
        String quotaName = ManifestBuilder.quotaName(ManifestBuilder.slug(environment.getIdentity()));
        try {
            ObservedResource quota = clusterAdapter.getResource(ResourceKind.RESOURCE_QUOTA,
                    environment.getNamespace(), quotaName);
            return quotaGovernor.evaluate(environment.getQuota(), quota.getQuotaUsed());
        } catch (AdapterException e) {
            log.warn("⚠️ Could not read quota of {}: {}", environment.getIdentity(), e.getMessage());
            return null;
        }
    }
}
