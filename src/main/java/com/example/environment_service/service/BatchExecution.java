package com.example.environment_service.service;

import com.example.environment_service.dto.BatchResult;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running batch. Cancelling lets items already started finish; items not yet
 * started are reported as cancelled.
 */
public class BatchExecution {

    @Getter
    private final String namePrefix;
    private final AtomicBoolean cancelled;
    private final CompletableFuture<BatchResult> result;

    BatchExecution(String namePrefix, AtomicBoolean cancelled, CompletableFuture<BatchResult> result) {
        this.namePrefix = namePrefix;
        this.cancelled = cancelled;
        this.result = result;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return result.isDone();
    }

    public CompletableFuture<BatchResult> result() {
        return result;
    }

    /**
     * Blocks until every item has a result.
     */
    public BatchResult await() {
        try {
            return result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
