package com.example.environment_service.service;

import com.example.environment_service.config.OrchestrationProperties;
import com.example.environment_service.exception.ValidationException;
import com.example.environment_service.model.Environment;
import com.example.environment_service.model.GitSource;
import com.example.environment_service.model.QuotaPolicy;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.model.ResourceSpec;
import com.example.environment_service.model.Template;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1DeploymentSpec;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1HTTPIngressPath;
import io.kubernetes.client.openapi.models.V1HTTPIngressRuleValue;
import io.kubernetes.client.openapi.models.V1Ingress;
import io.kubernetes.client.openapi.models.V1IngressBackend;
import io.kubernetes.client.openapi.models.V1IngressRule;
import io.kubernetes.client.openapi.models.V1IngressServiceBackend;
import io.kubernetes.client.openapi.models.V1IngressSpec;
import io.kubernetes.client.openapi.models.V1LabelSelector;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimSpec;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaimVolumeSource;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ResourceQuota;
import io.kubernetes.client.openapi.models.V1ResourceQuotaSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;
import io.kubernetes.client.openapi.models.V1Service;
import io.kubernetes.client.openapi.models.V1ServiceBackendPort;
import io.kubernetes.client.openapi.models.V1ServicePort;
import io.kubernetes.client.openapi.models.V1ServiceSpec;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a template and an environment record into the ordered list of cluster objects that
 * realise it. Pure: no I/O, and identical inputs always give identical names and order.
 *
 * <p>Order is namespace, quota, volume, workload, service, ingress. The quota must exist before
 * the workload so that no pod is admitted unmetered.</p>
 */
@Component
@RequiredArgsConstructor
public class ManifestBuilder {

    public static final String LABEL_APP = "app";
    public static final String LABEL_MANAGED_BY = "managed-by";
    public static final String LABEL_ENVIRONMENT_ID = "environment-id";
    public static final String LABEL_USER_ID = "user-id";
    public static final String MANAGER = "environment-service";

    static final String WORKSPACE_VOLUME = "workspace";
    static final String WORKSPACE_PATH = "/workspace";
    static final int MAX_SLUG_LENGTH = 40;

    private final OrchestrationProperties properties;

    public List<ResourceSpec> build(Template template, Environment environment) {
        String slug = slug(environment.getIdentity());
        Map<String, String> labels = labels(slug, environment);
        String namespace = namespaceName(slug);
        QuotaPolicy quota = environment.getQuota();

        List<ResourceSpec> specs = new ArrayList<>();
        specs.add(namespaceSpec(namespace, labels));
        specs.add(quotaSpec(namespace, slug, quota, labels));
        specs.add(volumeSpec(namespace, slug, quota, labels));
        specs.add(workloadSpec(template, environment));
        specs.add(serviceSpec(namespace, slug, environment.getExposedPorts(), labels));
        specs.add(ingressSpec(namespace, slug, environment.getExposedPorts(), labels));
        return specs;
    }

    public ResourceSpec workloadSpec(Template template, Environment environment) {
        String slug = slug(environment.getIdentity());
        Map<String, String> labels = labels(slug, environment);
        String namespace = namespaceName(slug);
        String name = workloadName(slug);
        QuotaPolicy quota = environment.getQuota();

        Map<String, Quantity> limits = new LinkedHashMap<>();
        limits.put("cpu", new Quantity(quota.getCpuMillicores() + "m"));
        limits.put("memory", new Quantity(String.valueOf(quota.getMemoryBytes())));
        Map<String, Quantity> requests = new LinkedHashMap<>();
        requests.put("cpu", new Quantity((quota.getCpuMillicores() / 2) + "m"));
        requests.put("memory", new Quantity(String.valueOf(quota.getMemoryBytes() / 2)));

        List<V1EnvVar> env = new ArrayList<>();
        new TreeMap<>(environment.getEnvironmentVariables() == null ? Map.<String, String>of()
                : environment.getEnvironmentVariables())
                .forEach((key, value) -> env.add(new V1EnvVar().name(key).value(value)));

        List<V1ContainerPort> containerPorts = new ArrayList<>();
        for (Integer port : ports(environment.getExposedPorts())) {
            containerPorts.add(new V1ContainerPort().containerPort(port));
        }

        V1VolumeMount workspaceMount = new V1VolumeMount().name(WORKSPACE_VOLUME).mountPath(WORKSPACE_PATH);
        V1Container ide = new V1Container()
                .name("ide")
                .image(environment.getImage())
                .env(env)
                .ports(containerPorts)
                .resources(new V1ResourceRequirements().limits(limits).requests(requests))
                .volumeMounts(List.of(workspaceMount))
                .workingDir(WORKSPACE_PATH);

        List<V1Container> initContainers = new ArrayList<>();
        GitSource git = environment.getGitSource();
        if (git != null && git.getRepositoryUrl() != null && !git.getRepositoryUrl().isBlank()) {
            initContainers.add(new V1Container()
                    .name("git-clone")
                    .image(properties.getGitCloneImage())
                    .command(List.of("sh", "-c"))
                    .args(List.of("git clone -b " + git.effectiveBranch() + " " + git.getRepositoryUrl() + " "
                            + WORKSPACE_PATH + " || (mkdir -p " + WORKSPACE_PATH
                            + " && echo 'Git clone failed, using empty workspace')"))
                    .volumeMounts(List.of(workspaceMount)));
        }

        Map<String, String> podLabels = new LinkedHashMap<>(labels);
        podLabels.put("component", "ide");

        V1Deployment deployment = new V1Deployment()
                .apiVersion("apps/v1")
                .kind("Deployment")
                .metadata(meta(name, namespace, labels))
                .spec(new V1DeploymentSpec()
                        .replicas(1)
                        .selector(new V1LabelSelector().matchLabels(Map.of(LABEL_APP, namespace)))
                        .template(new V1PodTemplateSpec()
                                .metadata(new V1ObjectMeta().labels(podLabels))
                                .spec(new V1PodSpec()
                                        .initContainers(initContainers)
                                        .containers(List.of(ide))
                                        .volumes(List.of(new V1Volume()
                                                .name(WORKSPACE_VOLUME)
                                                .persistentVolumeClaim(new V1PersistentVolumeClaimVolumeSource()
                                                        .claimName(volumeName(slug)))))
                                        .restartPolicy("Always"))));

        return spec(ResourceKind.DEPLOYMENT, namespace, name, labels, deployment);
    }

    private ResourceSpec namespaceSpec(String namespace, Map<String, String> labels) {
        V1Namespace body = new V1Namespace()
                .apiVersion("v1")
                .kind("Namespace")
                .metadata(new V1ObjectMeta().name(namespace).labels(labels));
        return spec(ResourceKind.NAMESPACE, null, namespace, labels, body);
    }

    private ResourceSpec quotaSpec(String namespace, String slug, QuotaPolicy quota, Map<String, String> labels) {
        Map<String, Quantity> hard = new LinkedHashMap<>();
        hard.put("limits.cpu", new Quantity(quota.getCpuMillicores() + "m"));
        hard.put("limits.memory", new Quantity(String.valueOf(quota.getMemoryBytes())));
        hard.put("requests.cpu", new Quantity((quota.getCpuMillicores() / 2) + "m"));
        hard.put("requests.memory", new Quantity(String.valueOf(quota.getMemoryBytes() / 2)));
        hard.put("requests.storage", new Quantity(String.valueOf(quota.getStorageBytes())));
        hard.put("pods", new Quantity(String.valueOf(quota.getMaxPods())));
        hard.put("services", new Quantity(String.valueOf(quota.getMaxServices())));
        hard.put("persistentvolumeclaims", new Quantity("3"));
        hard.put("secrets", new Quantity("10"));
        hard.put("configmaps", new Quantity("10"));

        String name = quotaName(slug);
        V1ResourceQuota body = new V1ResourceQuota()
                .apiVersion("v1")
                .kind("ResourceQuota")
                .metadata(meta(name, namespace, labels))
                .spec(new V1ResourceQuotaSpec().hard(hard));
        return spec(ResourceKind.RESOURCE_QUOTA, namespace, name, labels, body);
    }

    private ResourceSpec volumeSpec(String namespace, String slug, QuotaPolicy quota, Map<String, String> labels) {
        String name = volumeName(slug);
        V1PersistentVolumeClaim body = new V1PersistentVolumeClaim()
                .apiVersion("v1")
                .kind("PersistentVolumeClaim")
                .metadata(meta(name, namespace, labels))
                .spec(new V1PersistentVolumeClaimSpec()
                        .accessModes(List.of("ReadWriteOnce"))
                        .resources(new V1ResourceRequirements()
                                .requests(Map.of("storage", new Quantity(String.valueOf(quota.getStorageBytes()))))));
        return spec(ResourceKind.PERSISTENT_VOLUME_CLAIM, namespace, name, labels, body);
    }

    private ResourceSpec serviceSpec(String namespace, String slug, List<Integer> exposedPorts,
                                     Map<String, String> labels) {
        List<V1ServicePort> servicePorts = new ArrayList<>();
        List<Integer> ports = ports(exposedPorts);
        for (int i = 0; i < ports.size(); i++) {
            int port = ports.get(i);
            servicePorts.add(new V1ServicePort()
                    .name(i == 0 ? "http" : "port-" + port)
                    .port(port)
                    .targetPort(new IntOrString(port)));
        }
        String name = serviceName(slug);
        V1Service body = new V1Service()
                .apiVersion("v1")
                .kind("Service")
                .metadata(meta(name, namespace, labels))
                .spec(new V1ServiceSpec()
                        .type("ClusterIP")
                        .selector(Map.of(LABEL_APP, namespace))
                        .ports(servicePorts));
        return spec(ResourceKind.SERVICE, namespace, name, labels, body);
    }

    private ResourceSpec ingressSpec(String namespace, String slug, List<Integer> exposedPorts,
                                     Map<String, String> labels) {
        String name = ingressName(slug);
        V1Ingress body = new V1Ingress()
                .apiVersion("networking.k8s.io/v1")
                .kind("Ingress")
                .metadata(meta(name, namespace, labels))
                .spec(new V1IngressSpec().rules(List.of(new V1IngressRule()
                        .host(host(slug))
                        .http(new V1HTTPIngressRuleValue().paths(List.of(new V1HTTPIngressPath()
                                .path("/")
                                .pathType("Prefix")
                                .backend(new V1IngressBackend().service(new V1IngressServiceBackend()
                                        .name(serviceName(slug))
                                        .port(new V1ServiceBackendPort().number(ports(exposedPorts).get(0)))))))))));
        return spec(ResourceKind.INGRESS, namespace, name, labels, body);
    }

    public String accessUrl(String identity) {
        return "http://" + host(slug(identity));
    }

    private String host(String slug) {
        return slug + "." + properties.getIngressDomain();
    }

    private List<Integer> ports(List<Integer> exposedPorts) {
        return exposedPorts == null || exposedPorts.isEmpty() ? List.of(properties.getWorkspacePort()) : exposedPorts;
    }

    private Map<String, String> labels(String slug, Environment environment) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_APP, namespaceName(slug));
        labels.put(LABEL_MANAGED_BY, MANAGER);
        if (environment.getId() != null) {
            labels.put(LABEL_ENVIRONMENT_ID, environment.getId());
        }
        if (environment.getUserId() != null) {
            labels.put(LABEL_USER_ID, slug(environment.getUserId()));
        }
        return labels;
    }

    private static V1ObjectMeta meta(String name, String namespace, Map<String, String> labels) {
        return new V1ObjectMeta().name(name).namespace(namespace).labels(labels);
    }

    private static ResourceSpec spec(ResourceKind kind, String namespace, String name, Map<String, String> labels,
                                     io.kubernetes.client.common.KubernetesObject body) {
        return ResourceSpec.builder()
                .kind(kind)
                .namespace(namespace)
                .name(name)
                .labels(labels)
                .body(body)
                .build();
    }

    /**
     * Derive the DNS-safe slug every cluster name of an identity is built from.
     *
     * @throws ValidationException when nothing usable is left of the identity
     */
    public static String slug(String identity) {
        if (identity == null) {
            throw new ValidationException(null, "Identity is required");
        }
        String slug = identity.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+", "")
                .replaceAll("-+$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        if (slug.isEmpty()) {
            throw new ValidationException(identity, "Identity '" + identity + "' does not yield a valid name");
        }
        return slug;
    }

    public static String namespaceName(String slug) {
        return "env-" + slug;
    }

    public static String quotaName(String slug) {
        return "quota-" + slug;
    }

    public static String volumeName(String slug) {
        return "pvc-" + slug;
    }

    public static String workloadName(String slug) {
        return "env-" + slug;
    }

    public static String serviceName(String slug) {
        return "svc-" + slug;
    }

    public static String ingressName(String slug) {
        return "ing-" + slug;
    }
}
