package com.example.environment_service.service;

import com.example.environment_service.exception.QuotaExceedsCeilingException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.PressureLevel;
import com.example.environment_service.model.PressureReport;
import com.example.environment_service.model.QuotaOverrides;
import com.example.environment_service.model.QuotaPolicy;
import com.example.environment_service.model.QuotaUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.example.environment_service.service.TestFixtures.GI;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaGovernorTest {

    private QuotaGovernor governor;

    @BeforeEach
    void setUp() {
        governor = new QuotaGovernor(TestFixtures.properties());
    }

    @Test
    void resolve_noOverrides_returnsTemplateDefaults() {
        QuotaPolicy resolved = governor.resolve("alice", TestFixtures.limits(), QuotaOverrides.none());

        assertThat(resolved).isEqualTo(TestFixtures.limits());
    }

    @Test
    void resolve_partialOverrides_replaceOnlyGivenDimensions() {
        QuotaOverrides overrides = QuotaOverrides.builder().cpuMillicores(2000L).maxPods(8).build();

        QuotaPolicy resolved = governor.resolve("alice", TestFixtures.limits(), overrides);

        assertThat(resolved.getCpuMillicores()).isEqualTo(2000);
        assertThat(resolved.getMaxPods()).isEqualTo(8);
        assertThat(resolved.getMemoryBytes()).isEqualTo(2 * GI);
        assertThat(resolved.getStorageBytes()).isEqualTo(10 * GI);
        assertThat(resolved.getMaxServices()).isEqualTo(5);
    }

    @Test
    void resolve_missingTemplateDefaults_usesFallbackLimits() {
        QuotaPolicy resolved = governor.resolve("alice", null, null);

        assertThat(resolved.getCpuMillicores()).isEqualTo(1000);
        assertThat(resolved.getMemoryBytes()).isEqualTo(2 * GI);
    }

    @Test
    void resolve_aboveCeiling_rejectsNamingEveryDimension() {
        QuotaOverrides overrides = QuotaOverrides.builder().cpuMillicores(9000L).memoryBytes(32 * GI).build();

        assertThatThrownBy(() -> governor.resolve("alice", TestFixtures.limits(), overrides))
                .isInstanceOf(QuotaExceedsCeilingException.class)
                .satisfies(e -> assertThat(((QuotaExceedsCeilingException) e).getDimensions())
                        .containsExactly("cpu", "memory"));
    }

    @Test
    void resolve_exactlyAtCeiling_isAccepted() {
        QuotaPolicy ceiling = TestFixtures.limits();

        QuotaPolicy resolved = governor.resolve("alice", ceiling, QuotaOverrides.none(), ceiling);

        assertThat(resolved).isEqualTo(ceiling);
    }

    @Test
    void resolve_nonPositiveOverride_isValidationError() {
        QuotaOverrides overrides = QuotaOverrides.builder().memoryBytes(0L).build();

        assertThatThrownBy(() -> governor.resolve("alice", TestFixtures.limits(), overrides))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("memory");
    }

    @Test
    void evaluate_gradesEachDimensionAndOverallIsWorst() {
        QuotaUsage usage = QuotaUsage.builder().cpuMillicores(750).memoryBytes(GI).pods(5).build();

        PressureReport report = governor.evaluate(TestFixtures.limits(), usage);

        assertThat(report.getCpu()).isEqualTo(PressureLevel.WARNING);
        assertThat(report.getMemory()).isEqualTo(PressureLevel.NORMAL);
        assertThat(report.getPods()).isEqualTo(PressureLevel.CRITICAL);
        assertThat(report.getOverall()).isEqualTo(PressureLevel.CRITICAL);
        assertThat(report.getCpuRatio()).isEqualTo(0.75);
    }

    @Test
    void evaluate_zeroLimit_isNormal() {
        QuotaPolicy policy = TestFixtures.limits().toBuilder().cpuMillicores(0).build();
        QuotaUsage usage = QuotaUsage.builder().cpuMillicores(500).build();

        PressureReport report = governor.evaluate(policy, usage);

        assertThat(report.getCpu()).isEqualTo(PressureLevel.NORMAL);
        assertThat(report.getOverall()).isEqualTo(PressureLevel.NORMAL);
    }

    @Test
    void evaluate_missingUsage_isNormal() {
        PressureReport report = governor.evaluate(TestFixtures.limits(), null);

        assertThat(report.getOverall()).isEqualTo(PressureLevel.NORMAL);
    }
}
