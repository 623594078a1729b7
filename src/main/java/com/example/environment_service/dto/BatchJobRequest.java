package com.example.environment_service.dto;

import com.example.environment_service.model.QuotaOverrides;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A bounded set of create or delete operations sharing one template and quota policy.
 * Item identities are derived as {@code namePrefix-01 ... namePrefix-N}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobRequest {
    private BatchOperation operation;
    private int count;
    private String namePrefix;
    private String templateId;
    private QuotaOverrides quotaOverrides;
    private Long ttlSeconds;
    @Builder.Default
    private BatchMode mode = BatchMode.APPLY;
    private Integer concurrency;
}
