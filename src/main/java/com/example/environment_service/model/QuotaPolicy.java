package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Resolved resource ceiling enforced on one environment namespace.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuotaPolicy {
    private long cpuMillicores;
    private long memoryBytes;
    private long storageBytes;
    private int maxPods;
    private int maxServices;
}
