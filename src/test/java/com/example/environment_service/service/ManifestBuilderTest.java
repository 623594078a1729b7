package com.example.environment_service.service;

import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.GitSource;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.model.ResourceSpec;
import com.example.environment_service.model.Template;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1Ingress;
import io.kubernetes.client.openapi.models.V1ResourceQuota;
import io.kubernetes.client.openapi.models.V1Service;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestBuilderTest {

    private ManifestBuilder builder;
    private Template template;
    private Environment environment;

    @BeforeEach
    void setUp() {
        builder = new ManifestBuilder(TestFixtures.properties());
        template = TestFixtures.baseImageTemplate("code-server");
        environment = Environment.builder()
                .id("env-id-1")
                .identity("Alice.Smith")
                .userId("alice")
                .quota(TestFixtures.limits())
                .image("codercom/code-server:latest")
                .exposedPorts(List.of(8080, 3000))
                .environmentVariables(Map.of("USER_ID", "alice", "ENVIRONMENT_ID", "env-id-1"))
                .gitSource(new GitSource("https://github.com/acme/app.git", null))
                .build();
    }

    @Test
    void build_ordersQuotaBeforeWorkload() {
        List<ResourceKind> kinds = builder.build(template, environment).stream()
                .map(ResourceSpec::getKind)
                .collect(Collectors.toList());

        assertThat(kinds).containsExactly(
                ResourceKind.NAMESPACE,
                ResourceKind.RESOURCE_QUOTA,
                ResourceKind.PERSISTENT_VOLUME_CLAIM,
                ResourceKind.DEPLOYMENT,
                ResourceKind.SERVICE,
                ResourceKind.INGRESS);
    }

    @Test
    void build_derivesNamesFromSlug() {
        List<String> names = builder.build(template, environment).stream()
                .map(ResourceSpec::getName)
                .collect(Collectors.toList());

        assertThat(names).containsExactly(
                "env-alice-smith", "quota-alice-smith", "pvc-alice-smith",
                "env-alice-smith", "svc-alice-smith", "ing-alice-smith");
    }

    @Test
    void build_sameInputs_sameManifests() {
        List<ResourceSpec> first = builder.build(template, environment);
        List<ResourceSpec> second = builder.build(template, environment);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void build_labelsEveryObject() {
        for (ResourceSpec spec : builder.build(template, environment)) {
            assertThat(spec.getLabels())
                    .containsEntry("app", "env-alice-smith")
                    .containsEntry("managed-by", "environment-service")
                    .containsEntry("environment-id", "env-id-1")
                    .containsEntry("user-id", "alice");
        }
    }

    @Test
    void build_quotaCarriesHardLimits() {
        V1ResourceQuota quota = (V1ResourceQuota) builder.build(template, environment).get(1).getBody();

        assertThat(quota.getSpec().getHard())
                .containsKeys("limits.cpu", "limits.memory", "requests.cpu", "requests.memory",
                        "requests.storage", "pods", "services", "persistentvolumeclaims", "secrets", "configmaps");
        assertThat(quota.getSpec().getHard().get("limits.cpu").getNumber()).isEqualByComparingTo(new BigDecimal("1"));
        assertThat(quota.getSpec().getHard().get("requests.cpu").getNumber()).isEqualByComparingTo(new BigDecimal("0.5"));
        assertThat(quota.getSpec().getHard().get("pods").getNumber().intValue()).isEqualTo(5);
    }

    @Test
    void workload_clonesGitSourceIntoWorkspace() {
        V1Deployment deployment = (V1Deployment) builder.workloadSpec(template, environment).getBody();

        V1Container init = deployment.getSpec().getTemplate().getSpec().getInitContainers().get(0);
        assertThat(init.getName()).isEqualTo("git-clone");
        assertThat(init.getImage()).isEqualTo("alpine/git:latest");
        assertThat(init.getArgs().get(0))
                .startsWith("git clone -b main https://github.com/acme/app.git /workspace")
                .contains("using empty workspace");

        V1Container ide = deployment.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(ide.getName()).isEqualTo("ide");
        assertThat(ide.getImage()).isEqualTo("codercom/code-server:latest");
        assertThat(ide.getPorts()).extracting(p -> p.getContainerPort()).containsExactly(8080, 3000);
        assertThat(ide.getEnv()).extracting(e -> e.getName()).containsExactly("ENVIRONMENT_ID", "USER_ID");
        assertThat(deployment.getSpec().getReplicas()).isEqualTo(1);
    }

    @Test
    void workload_withoutGitSource_hasNoInitContainer() {
        environment.setGitSource(null);

        V1Deployment deployment = (V1Deployment) builder.workloadSpec(template, environment).getBody();

        assertThat(deployment.getSpec().getTemplate().getSpec().getInitContainers()).isEmpty();
    }

    @Test
    void service_namesFirstPortHttp() {
        V1Service service = (V1Service) builder.build(template, environment).get(4).getBody();

        assertThat(service.getSpec().getType()).isEqualTo("ClusterIP");
        assertThat(service.getSpec().getPorts()).extracting(p -> p.getName()).containsExactly("http", "port-3000");
    }

    @Test
    void ingress_routesHostToFirstServicePort() {
        V1Ingress ingress = (V1Ingress) builder.build(template, environment).get(5).getBody();

        assertThat(ingress.getSpec().getRules().get(0).getHost()).isEqualTo("alice-smith.envs.test");
        assertThat(ingress.getSpec().getRules().get(0).getHttp().getPaths().get(0).getBackend()
                .getService().getPort().getNumber()).isEqualTo(8080);
        assertThat(builder.accessUrl("Alice.Smith")).isEqualTo("http://alice-smith.envs.test");
    }

    @Test
    void service_withoutExposedPorts_usesWorkspacePort() {
        environment.setExposedPorts(List.of());

        V1Service service = (V1Service) builder.build(template, environment).get(4).getBody();

        assertThat(service.getSpec().getPorts()).extracting(p -> p.getPort()).containsExactly(8080);
    }

    @Test
    void slug_normalisesAndTruncates() {
        assertThat(ManifestBuilder.slug("  Team__Lab--07 ")).isEqualTo("team-lab-07");
        assertThat(ManifestBuilder.slug("a".repeat(60))).hasSize(40);
        assertThat(ManifestBuilder.slug("x".repeat(39) + "-yyy")).isEqualTo("x".repeat(39));
    }

    @Test
    void slug_nothingUsable_isRejected() {
        assertThatThrownBy(() -> ManifestBuilder.slug("___"))
                .isInstanceOf(ValidationException.class);
    }
}
