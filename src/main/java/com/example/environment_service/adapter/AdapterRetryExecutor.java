package com.example.environment_service.adapter;

import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.exception.AdapterException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs adapter calls with bounded exponential backoff. Only transient adapter errors are
 * retried; every other failure propagates on the first attempt.
 */
@Component
@Slf4j
public class AdapterRetryExecutor {

    private final RetryConfig retryConfig;

    public AdapterRetryExecutor(OrchestrationProperties properties) {
        OrchestrationProperties.Retry retry = properties.getRetry();
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, retry.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retry.getBaseDelay(), retry.getMultiplier()))
                .retryOnException(AdapterRetryExecutor::isTransient)
                .build();
    }

    public <T> T execute(String operation, Supplier<T> call) {
        Retry retry = Retry.of(operation, retryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Transient failure on '{}', attempt {} of {}: {}", operation,
                        event.getNumberOfRetryAttempts(), retryConfig.getMaxAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry.executeSupplier(call);
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    private static boolean isTransient(Throwable throwable) {
        return throwable instanceof AdapterException && ((AdapterException) throwable).isTransient();
    }
}
