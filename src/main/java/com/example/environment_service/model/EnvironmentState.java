package com.example.environment_service.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an environment and the transitions allowed out of each.
 */
public enum EnvironmentState {
    PENDING,
    PROVISIONING,
    RUNNING,
    DEGRADED,
    STOPPING,
    STOPPED,
    DELETING,
    DELETED,
    FAILED;

    private Set<EnvironmentState> next;

    static {
        PENDING.next = EnumSet.of(PROVISIONING, FAILED, DELETING);
        PROVISIONING.next = EnumSet.of(RUNNING, FAILED, DELETING);
        RUNNING.next = EnumSet.of(STOPPING, DEGRADED, DELETING);
        DEGRADED.next = EnumSet.of(RUNNING, STOPPING, DELETING);
        STOPPING.next = EnumSet.of(STOPPED, DELETING, FAILED);
        STOPPED.next = EnumSet.of(PROVISIONING, DELETING);
        DELETING.next = EnumSet.of(DELETED, FAILED);
        FAILED.next = EnumSet.of(DELETING);
        DELETED.next = EnumSet.noneOf(EnvironmentState.class);
    }

    public boolean canTransitionTo(EnvironmentState target) {
        return next.contains(target);
    }

    public Set<EnvironmentState> allowedTransitions() {
        return Collections.unmodifiableSet(next);
    }

    public boolean isTerminal() {
        return this == DELETED;
    }
}
