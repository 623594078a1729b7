package com.example.environment_service.dto;

import com.example.environment_service.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate outcome of a batch job. Items are reported in identity order, not completion order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {
    private BatchOperation operation;
    private BatchMode mode;
    private String namePrefix;
    private int totalRequested;
    private int succeeded;
    private int failed;
    private int cancelled;
    private long elapsedMillis;
    private List<BatchItemResult> items;
    // set only when the whole job was rejected before any item ran
    private ErrorKind errorKind;
    private String message;

    public static BatchResult of(BatchJobRequest job, List<BatchItemResult> items, long elapsedMillis) {
        return BatchResult.builder()
                .operation(job.getOperation())
                .mode(job.getMode())
                .namePrefix(job.getNamePrefix())
                .totalRequested(items.size())
                .succeeded(count(items, BatchItemOutcome.SUCCEEDED))
                .failed(count(items, BatchItemOutcome.FAILED))
                .cancelled(count(items, BatchItemOutcome.CANCELLED))
                .elapsedMillis(elapsedMillis)
                .items(List.copyOf(items))
                .build();
    }

    public static BatchResult rejected(BatchJobRequest job, ErrorKind errorKind, String message) {
        BatchResult result = of(job, List.of(), 0);
        result.setErrorKind(errorKind);
        result.setMessage(message);
        return result;
    }

    /**
     * @return identities of failed items, the subset a caller retries
     */
    @JsonIgnore
    public List<String> failedIdentities() {
        return items.stream()
                .filter(item -> item.getOutcome() == BatchItemOutcome.FAILED)
                .map(BatchItemResult::getIdentity)
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public long countOf(BatchItemOutcome outcome) {
        return items.stream().filter(item -> item.getOutcome() == outcome).count();
    }

    private static int count(List<BatchItemResult> items, BatchItemOutcome outcome) {
        return (int) items.stream().filter(item -> item.getOutcome() == outcome).count();
    }
}
