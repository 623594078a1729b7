package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request quota overrides. A {@code null} dimension falls back to the template default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaOverrides {
    private Long cpuMillicores;
    private Long memoryBytes;
    private Long storageBytes;
    private Integer maxPods;
    private Integer maxServices;

    public static QuotaOverrides none() {
        return new QuotaOverrides();
    }
}
