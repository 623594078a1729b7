package com.example.environment_service.service;

import com.example.environment_service.model.EnvironmentState;
import com.example.environment_service.model.ObservedState;

/**
 * Maps a recorded state plus what the cluster reports to the state the environment should be
 * recorded in. Has no side effects; the result is always a legal successor of {@code current}
 * or {@code current} itself.
 */
public final class EnvironmentStateReconciler {

    private EnvironmentStateReconciler() {
    }

    public static EnvironmentState next(EnvironmentState current, ObservedState observed, boolean deadlinePassed) {
        switch (current) {
            case PROVISIONING:
                if (isServing(observed)) {
                    return EnvironmentState.RUNNING;
                }
                return deadlinePassed ? EnvironmentState.FAILED : EnvironmentState.PROVISIONING;
            case RUNNING:
                return isServing(observed) ? EnvironmentState.RUNNING : EnvironmentState.DEGRADED;
            case DEGRADED:
                return isServing(observed) ? EnvironmentState.RUNNING : EnvironmentState.DEGRADED;
            case STOPPING:
                return observed.isWorkloadPresent() ? EnvironmentState.STOPPING : EnvironmentState.STOPPED;
            case DELETING:
                // a missing namespace takes every namespaced object with it
                return observed.isAllAbsent() || !observed.isNamespacePresent()
                        ? EnvironmentState.DELETED : EnvironmentState.DELETING;
            case PENDING:
            case STOPPED:
            case FAILED:
            case DELETED:
            default:
                return current;
        }
    }

    private static boolean isServing(ObservedState observed) {
        return observed.isNamespacePresent() && observed.isWorkloadReady() && observed.isNetworkEntryReady();
    }
}
