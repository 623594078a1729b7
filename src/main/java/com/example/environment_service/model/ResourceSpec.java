package com.example.environment_service.model;

import io.kubernetes.client.common.KubernetesObject;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One desired cluster object. {@code body} is the Kubernetes model to submit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceSpec {
    private ResourceKind kind;
    private String namespace;
    private String name;
    private Map<String, String> labels;
    private KubernetesObject body;

    public String describe() {
        return kind.getKubernetesKind() + "/" + (namespace == null ? "" : namespace + "/") + name;
    }
}
