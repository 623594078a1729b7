package com.example.environment_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Message sent by the external scheduler to run an expiry sweep.
 * A missing {@code now} means the service clock is used.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExpirySweepTrigger {
    private Instant now;
    private boolean dryRun;
}
