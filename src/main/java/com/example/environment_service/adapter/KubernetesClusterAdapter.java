package com.example.environment_service.adapter;

import com.example.environment_service.exception.AdapterException;
import com.example.environment_service.model.ObservedResource;
import com.example.environment_service.model.QuotaUsage;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.model.ResourceRef;
import com.example.environment_service.model.ResourceSpec;
import com.example.environment_service.service.ManifestBuilder;
import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.AppsV1Api;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.apis.NetworkingV1Api;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1Deployment;
import io.kubernetes.client.openapi.models.V1Ingress;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobStatus;
import io.kubernetes.client.openapi.models.V1Namespace;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PersistentVolumeClaim;
import io.kubernetes.client.openapi.models.V1ResourceQuota;
import io.kubernetes.client.openapi.models.V1Service;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link ClusterAdapter} backed by the official Kubernetes Java client.
 * Translates {@link ApiException} status codes into adapter error kinds at this boundary only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KubernetesClusterAdapter implements ClusterAdapter {

    private static final String PROPAGATION_BACKGROUND = "Background";
    private static final String MANAGED_SELECTOR = ManifestBuilder.LABEL_MANAGED_BY + "=" + ManifestBuilder.MANAGER;

    private final CoreV1Api coreApi;
    private final AppsV1Api appsApi;
    private final NetworkingV1Api networkingApi;
    private final BatchV1Api batchApi;

    @Override
    public ResourceRef createResource(ResourceSpec spec) {
        String namespace = spec.getNamespace();
        log.info("Creating {} ...", spec.describe());
        try {
            KubernetesObject created;
            switch (spec.getKind()) {
                case NAMESPACE:
                    created = coreApi.createNamespace((V1Namespace) spec.getBody(), null, null, null, null);
                    break;
                case RESOURCE_QUOTA:
                    created = coreApi.createNamespacedResourceQuota(namespace, (V1ResourceQuota) spec.getBody(),
                            null, null, null, null);
                    break;
                case PERSISTENT_VOLUME_CLAIM:
                    created = coreApi.createNamespacedPersistentVolumeClaim(namespace,
                            (V1PersistentVolumeClaim) spec.getBody(), null, null, null, null);
                    break;
                case DEPLOYMENT:
                    created = appsApi.createNamespacedDeployment(namespace, (V1Deployment) spec.getBody(),
                            null, null, null, null);
                    break;
                case SERVICE:
                    created = coreApi.createNamespacedService(namespace, (V1Service) spec.getBody(),
                            null, null, null, null);
                    break;
                case INGRESS:
                    created = networkingApi.createNamespacedIngress(namespace, (V1Ingress) spec.getBody(),
                            null, null, null, null);
                    break;
                case CONFIG_MAP:
                    created = coreApi.createNamespacedConfigMap(namespace, (V1ConfigMap) spec.getBody(),
                            null, null, null, null);
                    break;
                case JOB:
                    created = batchApi.createNamespacedJob(namespace, (V1Job) spec.getBody(), null, null, null, null);
                    break;
                default:
                    throw AdapterException.rejected(spec.getName(), "Unsupported resource kind " + spec.getKind());
            }
            log.info("{} created successfully.", spec.describe());
            V1ObjectMeta meta = created.getMetadata();
            return new ResourceRef(spec.getKind(), namespace, spec.getName(),
                    meta != null ? meta.getUid() : null,
                    meta != null && meta.getCreationTimestamp() != null ? meta.getCreationTimestamp().toInstant() : null);
        } catch (ApiException e) {
            throw translate(e, "create " + spec.describe(), spec.getName());
        }
    }

    @Override
    public ObservedResource getResource(ResourceKind kind, String namespace, String name) {
        try {
            switch (kind) {
                case NAMESPACE: {
                    V1Namespace ns = coreApi.readNamespace(name, null);
                    ObservedResource observed = observe(kind, ns);
                    observed.setPhase(ns.getStatus() != null ? ns.getStatus().getPhase() : null);
                    observed.setTerminating(observed.isTerminating() || "Terminating".equals(observed.getPhase()));
                    return observed;
                }
                case RESOURCE_QUOTA: {
                    V1ResourceQuota quota = coreApi.readNamespacedResourceQuota(name, namespace, null);
                    ObservedResource observed = observe(kind, quota);
                    observed.setQuotaUsed(toUsage(quota.getStatus() != null ? quota.getStatus().getUsed() : null));
                    return observed;
                }
                case PERSISTENT_VOLUME_CLAIM: {
                    V1PersistentVolumeClaim pvc = coreApi.readNamespacedPersistentVolumeClaim(name, namespace, null);
                    ObservedResource observed = observe(kind, pvc);
                    observed.setPhase(pvc.getStatus() != null ? pvc.getStatus().getPhase() : null);
                    return observed;
                }
                case DEPLOYMENT: {
                    V1Deployment deployment = appsApi.readNamespacedDeployment(name, namespace, null);
                    ObservedResource observed = observe(kind, deployment);
                    Integer desired = deployment.getSpec() != null ? deployment.getSpec().getReplicas() : null;
                    Integer ready = deployment.getStatus() != null ? deployment.getStatus().getReadyReplicas() : null;
                    observed.setDesiredReplicas(desired != null ? desired : 1);
                    observed.setReadyReplicas(ready != null ? ready : 0);
                    return observed;
                }
                case SERVICE:
                    return observe(kind, coreApi.readNamespacedService(name, namespace, null));
                case INGRESS:
                    return observe(kind, networkingApi.readNamespacedIngress(name, namespace, null));
                case CONFIG_MAP:
                    return observe(kind, coreApi.readNamespacedConfigMap(name, namespace, null));
                case JOB: {
                    V1Job job = batchApi.readNamespacedJob(name, namespace, null);
                    ObservedResource observed = observe(kind, job);
                    observed.setPhase(jobPhase(job.getStatus()));
                    return observed;
                }
                default:
                    throw AdapterException.rejected(name, "Unsupported resource kind " + kind);
            }
        } catch (ApiException e) {
            throw translate(e, "read " + kind.getKubernetesKind() + " '" + name + "'", name);
        }
    }

    @Override
    public void deleteResource(ResourceKind kind, String namespace, String name) {
        log.info("Deleting {} '{}' in namespace '{}'", kind.getKubernetesKind(), name, namespace);
        try {
            switch (kind) {
                case NAMESPACE:
                    coreApi.deleteNamespace(name, null, null, null, null, PROPAGATION_BACKGROUND, null);
                    break;
                case RESOURCE_QUOTA:
                    coreApi.deleteNamespacedResourceQuota(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                case PERSISTENT_VOLUME_CLAIM:
                    coreApi.deleteNamespacedPersistentVolumeClaim(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                case DEPLOYMENT:
                    appsApi.deleteNamespacedDeployment(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                case SERVICE:
                    coreApi.deleteNamespacedService(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                case INGRESS:
                    networkingApi.deleteNamespacedIngress(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                case CONFIG_MAP:
                    coreApi.deleteNamespacedConfigMap(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                case JOB:
                    batchApi.deleteNamespacedJob(name, namespace, null, null, null, null,
                            PROPAGATION_BACKGROUND, null);
                    break;
                default:
                    throw AdapterException.rejected(name, "Unsupported resource kind " + kind);
            }
            log.info("{} '{}' deleted.", kind.getKubernetesKind(), name);
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                log.info("{} '{}' already absent.", kind.getKubernetesKind(), name);
                return;
            }
            throw translate(e, "delete " + kind.getKubernetesKind() + " '" + name + "'", name);
        }
    }

    @Override
    public List<ObservedResource> listResources(ResourceKind kind, String namespaceFilter) {
        if (kind == ResourceKind.NAMESPACE) {
            return listNamespaces(namespaceFilter);
        }
        if (namespaceFilter == null) {
            List<ObservedResource> all = new ArrayList<>();
            for (ObservedResource ns : listNamespaces(null)) {
                all.addAll(listNamespaced(kind, ns.getName()));
            }
            return all;
        }
        return listNamespaced(kind, namespaceFilter);
    }

    private List<ObservedResource> listNamespaces(String namePrefix) {
        try {
            return coreApi.listNamespace(null, null, null, null, MANAGED_SELECTOR, null, null, null, null, false)
                    .getItems().stream()
                    .filter(ns -> namePrefix == null || ns.getMetadata().getName().startsWith(namePrefix))
                    .map(ns -> {
                        ObservedResource observed = observe(ResourceKind.NAMESPACE, ns);
                        observed.setPhase(ns.getStatus() != null ? ns.getStatus().getPhase() : null);
                        return observed;
                    })
                    .collect(Collectors.toList());
        } catch (ApiException e) {
            throw translate(e, "list namespaces", namePrefix);
        }
    }

    private List<ObservedResource> listNamespaced(ResourceKind kind, String namespace) {
        try {
            KubernetesListObject list;
            switch (kind) {
                case RESOURCE_QUOTA:
                    list = coreApi.listNamespacedResourceQuota(namespace, null, null, null, null, MANAGED_SELECTOR,
                            null, null, null, null, false);
                    break;
                case PERSISTENT_VOLUME_CLAIM:
                    list = coreApi.listNamespacedPersistentVolumeClaim(namespace, null, null, null, null,
                            MANAGED_SELECTOR, null, null, null, null, false);
                    break;
                case DEPLOYMENT:
                    list = appsApi.listNamespacedDeployment(namespace, null, null, null, null, MANAGED_SELECTOR,
                            null, null, null, null, false);
                    break;
                case SERVICE:
                    list = coreApi.listNamespacedService(namespace, null, null, null, null, MANAGED_SELECTOR,
                            null, null, null, null, false);
                    break;
                case INGRESS:
                    list = networkingApi.listNamespacedIngress(namespace, null, null, null, null, MANAGED_SELECTOR,
                            null, null, null, null, false);
                    break;
                case CONFIG_MAP:
                    list = coreApi.listNamespacedConfigMap(namespace, null, null, null, null, MANAGED_SELECTOR,
                            null, null, null, null, false);
                    break;
                case JOB:
                    list = batchApi.listNamespacedJob(namespace, null, null, null, null, MANAGED_SELECTOR,
                            null, null, null, null, false);
                    break;
                default:
                    throw AdapterException.rejected(namespace, "Unsupported resource kind " + kind);
            }
            List<ObservedResource> observed = new ArrayList<>();
            for (Object item : list.getItems()) {
                observed.add(observe(kind, (KubernetesObject) item));
            }
            return observed;
        } catch (ApiException e) {
            throw translate(e, "list " + kind.getKubernetesKind() + " in '" + namespace + "'", namespace);
        }
    }

    static AdapterException translate(ApiException e, String operation, String identity) {
        int code = e.getCode();
        String message = "Failed to " + operation + " (status " + code + ")";
        if (code == 409) {
            log.warn("{}: name already taken", message);
            return AdapterException.conflict(identity, message + ": already exists");
        }
        if (code == 404) {
            return AdapterException.notFound(identity, message + ": not found");
        }
        if (code == 0 || code == 408 || code == 429 || code >= 500) {
            log.warn("{}: transient error {}", message, e.getMessage());
            return AdapterException.transientError(identity, message, e);
        }
        log.error("K8s API rejected request. Status code: {}. Response body: {}", code, e.getResponseBody());
        return AdapterException.rejected(identity, message + ": " + e.getResponseBody());
    }

    static QuotaUsage toUsage(Map<String, Quantity> used) {
        if (used == null) {
            return QuotaUsage.empty();
        }
        Quantity cpu = used.getOrDefault("limits.cpu", used.get("requests.cpu"));
        Quantity memory = used.getOrDefault("limits.memory", used.get("requests.memory"));
        Quantity pods = used.get("pods");
        return QuotaUsage.builder()
                .cpuMillicores(cpu != null ? cpu.getNumber().multiply(BigDecimal.valueOf(1000)).longValue() : 0)
                .memoryBytes(memory != null ? memory.getNumber().longValue() : 0)
                .pods(pods != null ? pods.getNumber().intValue() : 0)
                .build();
    }

    private static String jobPhase(V1JobStatus status) {
        if (status == null) {
            return "Pending";
        }
        if (status.getSucceeded() != null && status.getSucceeded() > 0) {
            return "Succeeded";
        }
        if (status.getFailed() != null && status.getFailed() > 0) {
            return "Failed";
        }
        return "Running";
    }

    private static ObservedResource observe(ResourceKind kind, KubernetesObject object) {
        V1ObjectMeta meta = object.getMetadata();
        return ObservedResource.builder()
                .kind(kind)
                .namespace(meta.getNamespace())
                .name(meta.getName())
                .labels(meta.getLabels())
                .createdAt(meta.getCreationTimestamp() != null ? meta.getCreationTimestamp().toInstant() : null)
                .terminating(meta.getDeletionTimestamp() != null)
                .quotaUsed(QuotaUsage.empty())
                .build();
    }
}
