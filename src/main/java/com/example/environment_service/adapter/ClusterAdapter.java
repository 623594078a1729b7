package com.example.environment_service.adapter;

import com.example.environment_service.exception.AdapterException;
import com.example.environment_service.model.ObservedResource;
import com.example.environment_service.model.ResourceKind;
import com.example.environment_service.model.ResourceRef;
import com.example.environment_service.model.ResourceSpec;

import java.util.List;

/**
 * Capability interface to the cluster control plane.
 * <p>
 * Every method reports failures as {@link AdapterException}; callers retry only the
 * transient kind. Name collisions surface as a conflict and are authoritative, so callers
 * never check for existence before creating.
 */
public interface ClusterAdapter {

    /**
     * Submit one resource.
     *
     * @throws AdapterException with kind conflict when the name is already taken
     */
    ResourceRef createResource(ResourceSpec spec);

    /**
     * Read the observed state of one resource.
     *
     * @param namespace ignored for cluster-scoped kinds
     * @throws AdapterException with kind not-found when the resource is absent
     */
    ObservedResource getResource(ResourceKind kind, String namespace, String name);

    /**
     * Delete one resource. Deleting an absent resource succeeds.
     */
    void deleteResource(ResourceKind kind, String namespace, String name);

    /**
     * List resources of a kind.
     *
     * @param namespaceFilter for namespaced kinds the namespace to list, for namespaces a name prefix;
     *                        {@code null} lists everything this service manages
     */
    List<ObservedResource> listResources(ResourceKind kind, String namespaceFilter);
}
