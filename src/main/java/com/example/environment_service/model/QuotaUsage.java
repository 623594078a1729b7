package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsage {
    private long cpuMillicores;
    private long memoryBytes;
    private int pods;

    public static QuotaUsage empty() {
        return new QuotaUsage(0, 0, 0);
    }
}
