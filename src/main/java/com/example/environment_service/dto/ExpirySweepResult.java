package com.example.environment_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpirySweepResult {
    private Instant sweptAt;
    private boolean dryRun;
    private List<String> expiredEnvironmentIds;
    private List<String> deleteInitiated;
    private List<String> deleteFailed;
}
