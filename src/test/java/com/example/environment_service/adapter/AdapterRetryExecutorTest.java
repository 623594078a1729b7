package com.example.environment_service.adapter;

import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.exception.AdapterException;
import com.example.environment_service.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterRetryExecutorTest {

    private AdapterRetryExecutor executor;
    private final AtomicInteger attempts = new AtomicInteger();

    @BeforeEach
    void setUp() {
        OrchestrationProperties properties = new OrchestrationProperties();
        properties.getRetry().setBaseDelay(Duration.ofMillis(1));
        properties.getRetry().setMultiplier(1.0);
        properties.getRetry().setMaxAttempts(3);
        executor = new AdapterRetryExecutor(properties);
    }

    @Test
    void execute_transientThenSuccess_returnsValue() {
        String result = executor.execute("get Namespace/env-a", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw AdapterException.transientError("a", "connection reset", null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void execute_transientExhausted_rethrowsLastFailure() {
        assertThatThrownBy(() -> executor.execute("get Namespace/env-a", () -> {
            attempts.incrementAndGet();
            throw AdapterException.transientError("a", "timeout", null);
        })).isInstanceOf(AdapterException.class).hasMessage("timeout");

        assertThat(attempts).hasValue(3);
    }

    @Test
    void execute_conflict_isNotRetried() {
        assertThatThrownBy(() -> executor.run("create Namespace/env-a", () -> {
            attempts.incrementAndGet();
            throw AdapterException.conflict("a", "exists");
        })).isInstanceOf(AdapterException.class);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void execute_nonAdapterFailure_isNotRetried() {
        assertThatThrownBy(() -> executor.run("create Namespace/env-a", () -> {
            attempts.incrementAndGet();
            throw new ValidationException("a", "bad");
        })).isInstanceOf(ValidationException.class);

        assertThat(attempts).hasValue(1);
    }
}
