package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster-observed status of one environment, assembled from its owned resources.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservedState {
    private String namespacePhase;
    private boolean namespacePresent;
    private boolean quotaPresent;
    private QuotaUsage quotaUsed;
    private boolean workloadPresent;
    private int workloadReadyReplicas;
    private int workloadDesiredReplicas;
    private boolean volumePresent;
    private boolean servicePresent;
    private boolean ingressPresent;

    public boolean isWorkloadReady() {
        return workloadPresent && workloadDesiredReplicas > 0 && workloadReadyReplicas >= workloadDesiredReplicas;
    }

    public boolean isNetworkEntryReady() {
        return servicePresent && ingressPresent;
    }

    public boolean isAllAbsent() {
        return !namespacePresent && !quotaPresent && !volumePresent && !workloadPresent
                && !servicePresent && !ingressPresent;
    }
}
