package com.example.environment_service.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ResourceKind {
    NAMESPACE("Namespace", false),
    RESOURCE_QUOTA("ResourceQuota", true),
    PERSISTENT_VOLUME_CLAIM("PersistentVolumeClaim", true),
    DEPLOYMENT("Deployment", true),
    SERVICE("Service", true),
    INGRESS("Ingress", true),
    CONFIG_MAP("ConfigMap", true),
    JOB("Job", true);

    private final String kubernetesKind;
    private final boolean namespaced;
}
