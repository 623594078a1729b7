package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PressureReport {
    private PressureLevel cpu;
    private PressureLevel memory;
    private PressureLevel pods;
    private PressureLevel overall;
    private double cpuRatio;
    private double memoryRatio;
    private double podsRatio;
}
