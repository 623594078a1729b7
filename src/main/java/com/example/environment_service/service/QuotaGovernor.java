package com.example.environment_service.service;

import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.exception.QuotaExceedsCeilingException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.PressureLevel;
import com.example.environment_service.model.PressureReport;
import com.example.environment_service.model.QuotaOverrides;
import com.example.environment_service.model.QuotaPolicy;
import com.example.environment_service.model.QuotaUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the quota an environment runs under and grades how close live usage is to it.
 * A value above the global ceiling is rejected, never clamped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QuotaGovernor {

    private final OrchestrationProperties properties;

    public QuotaPolicy resolve(String identity, QuotaPolicy templateDefaults, QuotaOverrides overrides) {
        return resolve(identity, templateDefaults, overrides, properties.getGlobalCeiling());
    }

    public QuotaPolicy resolve(String identity, QuotaPolicy templateDefaults, QuotaOverrides overrides,
                               QuotaPolicy ceiling) {
        QuotaPolicy defaults = templateDefaults != null ? templateDefaults : properties.getFallbackLimits();
        QuotaOverrides o = overrides != null ? overrides : QuotaOverrides.none();

        QuotaPolicy resolved = QuotaPolicy.builder()
                .cpuMillicores(o.getCpuMillicores() != null ? o.getCpuMillicores() : defaults.getCpuMillicores())
                .memoryBytes(o.getMemoryBytes() != null ? o.getMemoryBytes() : defaults.getMemoryBytes())
                .storageBytes(o.getStorageBytes() != null ? o.getStorageBytes() : defaults.getStorageBytes())
                .maxPods(o.getMaxPods() != null ? o.getMaxPods() : defaults.getMaxPods())
                .maxServices(o.getMaxServices() != null ? o.getMaxServices() : defaults.getMaxServices())
                .build();

        List<String> nonPositive = new ArrayList<>();
        if (resolved.getCpuMillicores() <= 0) nonPositive.add("cpu");
        if (resolved.getMemoryBytes() <= 0) nonPositive.add("memory");
        if (resolved.getStorageBytes() <= 0) nonPositive.add("storage");
        if (resolved.getMaxPods() <= 0) nonPositive.add("pods");
        if (resolved.getMaxServices() <= 0) nonPositive.add("services");
        if (!nonPositive.isEmpty()) {
            throw new ValidationException(identity, "Quota values must be positive: " + nonPositive);
        }

        List<String> exceeded = new ArrayList<>();
        if (resolved.getCpuMillicores() > ceiling.getCpuMillicores()) exceeded.add("cpu");
        if (resolved.getMemoryBytes() > ceiling.getMemoryBytes()) exceeded.add("memory");
        if (resolved.getStorageBytes() > ceiling.getStorageBytes()) exceeded.add("storage");
        if (resolved.getMaxPods() > ceiling.getMaxPods()) exceeded.add("pods");
        if (resolved.getMaxServices() > ceiling.getMaxServices()) exceeded.add("services");
        if (!exceeded.isEmpty()) {
            log.warn("⚠️ Quota for '{}' exceeds global ceiling on {}", identity, exceeded);
            throw new QuotaExceedsCeilingException(identity, exceeded);
        }

        log.debug("Resolved quota for '{}': {}", identity, resolved);
        return resolved;
    }

    public PressureReport evaluate(QuotaPolicy policy, QuotaUsage usage) {
        QuotaUsage used = usage != null ? usage : QuotaUsage.empty();
        double cpuRatio = ratio(used.getCpuMillicores(), policy.getCpuMillicores());
        double memoryRatio = ratio(used.getMemoryBytes(), policy.getMemoryBytes());
        double podsRatio = ratio(used.getPods(), policy.getMaxPods());

        PressureLevel cpu = level(cpuRatio);
        PressureLevel memory = level(memoryRatio);
        PressureLevel pods = level(podsRatio);

        return PressureReport.builder()
                .cpu(cpu)
                .memory(memory)
                .pods(pods)
                .overall(cpu.max(memory).max(pods))
                .cpuRatio(cpuRatio)
                .memoryRatio(memoryRatio)
                .podsRatio(podsRatio)
                .build();
    }

    private PressureLevel level(double ratio) {
        OrchestrationProperties.Pressure pressure = properties.getPressure();
        if (ratio >= pressure.getCriticalRatio()) {
            return PressureLevel.CRITICAL;
        }
        if (ratio >= pressure.getWarningRatio()) {
            return PressureLevel.WARNING;
        }
        return PressureLevel.NORMAL;
    }

    // zero limit reads as no pressure
    private static double ratio(long used, long limit) {
        return limit <= 0 ? 0.0 : (double) used / limit;
    }
}
