package com.example.environment_service.service;

import com.example.environment_service.adapter.AdapterRetryExecutor;
import com.example.environment_service.adapter.FakeClusterAdapter;
import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.dto.TemplateValidationResult;
import com.example.environment_service.exception.NotFoundException;
import com.example.environment_service.exception.QuotaExceedsCeilingException;
import com.example.environment_service.exception.TemplateInUseException;
import com.example.environment_service.exception.UnsupportedStackException;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.EnvironmentState;
import com.example.environment_service.model.StackConfig;
import com.example.environment_service.model.Template;
import com.example.environment_service.repository.InMemoryEnvironmentRepository;
import com.example.environment_service.repository.InMemoryTemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateServiceTest {

    private FakeClusterAdapter cluster;
    private InMemoryEnvironmentRepository environments;
    private MutableClock clock;
    private TemplateService service;

    @BeforeEach
    void setUp() {
        OrchestrationProperties properties = TestFixtures.properties();
        cluster = new FakeClusterAdapter();
        environments = new InMemoryEnvironmentRepository();
        clock = new MutableClock(TestFixtures.NOW);
        AdapterRetryExecutor retryExecutor = new AdapterRetryExecutor(properties);
        StackImageCompiler compiler = new StackImageCompiler(new StackMatrix(properties), cluster, retryExecutor, properties);

        service = new TemplateService(new InMemoryTemplateRepository(), environments,
                new QuotaGovernor(properties), compiler, clock);
    }

    private void referenceFrom(String templateId, EnvironmentState state) {
        environments.save(Environment.builder()
                .id("env-1")
                .identity("alice")
                .userId("alice")
                .namespace("env-alice")
                .templateId(templateId)
                .state(state)
                .build());
    }

    @Test
    void register_stackTemplate_startsVersionOneAndSubmitsBuild() {
        Template registered = service.register(TestFixtures.stackTemplate("py-fastapi").toBuilder().version(7).build());

        assertThat(registered.getVersion()).isEqualTo(1);
        assertThat(registered.getCreatedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(cluster.creates()).hasSize(2);
        assertThat(cluster.creates().get(0)).startsWith("ConfigMap/env-builds/build-py-fastapi-");
        assertThat(cluster.creates().get(1)).startsWith("Job/env-builds/build-py-fastapi-");
    }

    @Test
    void register_baseImageTemplate_submitsNoBuild() {
        service.register(TestFixtures.baseImageTemplate("code-server"));

        assertThat(cluster.calls()).isEmpty();
        assertThat(service.list()).extracting(Template::getId).containsExactly("code-server");
    }

    @Test
    void register_duplicateId_isValidationError() {
        service.register(TestFixtures.baseImageTemplate("code-server"));

        assertThatThrownBy(() -> service.register(TestFixtures.baseImageTemplate("code-server")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void register_withoutImageOrStack_isValidationError() {
        Template empty = TestFixtures.baseImageTemplate("empty").toBuilder().baseImage(null).build();

        assertThatThrownBy(() -> service.register(empty)).isInstanceOf(ValidationException.class);
    }

    @Test
    void register_unsupportedLanguage_isRejected() {
        Template cobol = TestFixtures.stackTemplate("cobol").toBuilder()
                .stack(StackConfig.builder().language("cobol").version("85").build())
                .build();

        assertThatThrownBy(() -> service.register(cobol)).isInstanceOf(UnsupportedStackException.class);
        assertThat(cluster.calls()).isEmpty();
    }

    @Test
    void register_defaultsAboveCeiling_isRejected() {
        Template greedy = TestFixtures.baseImageTemplate("greedy").toBuilder()
                .defaultLimits(TestFixtures.limits().toBuilder().maxPods(500).build())
                .build();

        assertThatThrownBy(() -> service.register(greedy)).isInstanceOf(QuotaExceedsCeilingException.class);
    }

    @Test
    void update_unreferencedTemplate_bumpsVersion() {
        service.register(TestFixtures.baseImageTemplate("code-server"));
        clock.advance(Duration.ofMinutes(5));

        Template updated = service.update("code-server",
                TestFixtures.baseImageTemplate("ignored").toBuilder().baseImage("codercom/code-server:4.20.0").build());

        assertThat(updated.getId()).isEqualTo("code-server");
        assertThat(updated.getVersion()).isEqualTo(2);
        assertThat(updated.getCreatedAt()).isEqualTo(TestFixtures.NOW);
        assertThat(updated.getUpdatedAt()).isEqualTo(TestFixtures.NOW.plusSeconds(300));
        assertThat(service.get("code-server").getBaseImage()).isEqualTo("codercom/code-server:4.20.0");
    }

    @Test
    void update_templateReferencedByLiveEnvironment_isRejected() {
        service.register(TestFixtures.baseImageTemplate("code-server"));
        referenceFrom("code-server", EnvironmentState.RUNNING);

        assertThatThrownBy(() -> service.update("code-server", TestFixtures.baseImageTemplate("code-server")))
                .isInstanceOf(TemplateInUseException.class);
        assertThat(service.get("code-server").getVersion()).isEqualTo(1);
    }

    @Test
    void delete_referencedOnlyByDeletedEnvironment_isAllowed() {
        service.register(TestFixtures.baseImageTemplate("code-server"));
        referenceFrom("code-server", EnvironmentState.DELETED);

        service.delete("code-server");

        assertThatThrownBy(() -> service.get("code-server")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void delete_referencedTemplate_isRejected() {
        service.register(TestFixtures.baseImageTemplate("code-server"));
        referenceFrom("code-server", EnvironmentState.STOPPED);

        assertThatThrownBy(() -> service.delete("code-server")).isInstanceOf(TemplateInUseException.class);
    }

    @Test
    void validate_stackTemplate_reportsImageTagAndNoProblems() {
        service.register(TestFixtures.stackTemplate("py-fastapi"));

        TemplateValidationResult result = service.validate("py-fastapi");

        assertThat(result.isValid()).isTrue();
        assertThat(result.getProblems()).isEmpty();
        assertThat(result.getImageTag()).startsWith("registry.local/envs/py-fastapi:");
    }

    @Test
    void validate_unpinnedBaseImage_isReported() {
        service.register(TestFixtures.baseImageTemplate("plain").toBuilder().baseImage("ubuntu").build());

        TemplateValidationResult result = service.validate("plain");

        assertThat(result.isValid()).isFalse();
        assertThat(result.getProblems()).containsExactly("Base image should be pinned with a tag");
        assertThat(cluster.calls()).isEmpty();
    }

    @Test
    void validate_unknownTemplate_isNotFound() {
        assertThatThrownBy(() -> service.validate("missing")).isInstanceOf(NotFoundException.class);
    }
}
