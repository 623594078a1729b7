package com.example.environment_service.config;

import com.example.environment_service.model.QuotaPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Policy knobs of the orchestration engine, bound to the {@code orchestration} prefix.
 *
 * <p>Defaults mirror the values shipped in {@code application.yml} so that services built
 * outside a Spring context (unit tests) behave the same as the running application.</p>
 */
@ConfigurationProperties(prefix = "orchestration")
@Getter
@Setter
public class OrchestrationProperties {

    /** Lifetime given to environments that do not ask for one. */
    private Duration defaultTtl = Duration.ofHours(8);

    /** A create that has not reached RUNNING within this window is marked FAILED. */
    private Duration provisioningTimeout = Duration.ofMinutes(10);

    /** Interval between reconcile calls while waiting for an environment to become ready. */
    private Duration readinessPollInterval = Duration.ofSeconds(5);

    private String ingressDomain = "envs.local";

    private String gitCloneImage = "alpine/git:latest";

    private int workspacePort = 8080;

    private QuotaPolicy globalCeiling = QuotaPolicy.builder()
            .cpuMillicores(8000)
            .memoryBytes(16L * 1024 * 1024 * 1024)
            .storageBytes(100L * 1024 * 1024 * 1024)
            .maxPods(20)
            .maxServices(10)
            .build();

    /** Limits used when a template declares none. */
    private QuotaPolicy fallbackLimits = QuotaPolicy.builder()
            .cpuMillicores(1000)
            .memoryBytes(2L * 1024 * 1024 * 1024)
            .storageBytes(10L * 1024 * 1024 * 1024)
            .maxPods(5)
            .maxServices(5)
            .build();

    private Pressure pressure = new Pressure();
    private Retry retry = new Retry();
    private Batch batch = new Batch();
    private Image image = new Image();

    @Getter
    @Setter
    public static class Pressure {
        private double warningRatio = 0.70;
        private double criticalRatio = 0.90;
        private Duration expiryWarningWindow = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Retry {
        private Duration baseDelay = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private int maxAttempts = 4;
    }

    @Getter
    @Setter
    public static class Batch {
        private int maxSize = 200;
        private int defaultConcurrency = 10;
        private int maxConcurrency = 50;
    }

    @Getter
    @Setter
    public static class Image {
        private String registry = "registry.local/envs";
        private String buildNamespace = "env-builds";
        private String kanikoImage = "gcr.io/kaniko-project/executor:latest";
        private String stackMatrixLocation = "stacks/supported-stacks.yaml";
    }
}
