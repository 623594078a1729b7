package com.example.environment_service.dto;

import com.example.environment_service.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchItemResult {
    private String identity;
    private BatchItemOutcome outcome;
    private String environmentId;
    private ErrorKind errorKind;
    private String message;
    private long durationMillis;

    public static BatchItemResult cancelled(String identity) {
        return BatchItemResult.builder()
                .identity(identity)
                .outcome(BatchItemOutcome.CANCELLED)
                .message("Batch cancelled before the item started")
                .build();
    }
}
