package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User record produced by a batch create item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SandboxUser {
    private String id;
    private String environmentId;
    private String batchPrefix;
    private Instant createdAt;
}
