package com.example.environment_service.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class EnvironmentStateTest {

    @ParameterizedTest
    @EnumSource(value = EnvironmentState.class, names = {"DELETING", "DELETED"}, mode = EnumSource.Mode.EXCLUDE)
    void canTransitionTo_deletingFromEveryLiveState(EnvironmentState state) {
        assertThat(state.canTransitionTo(EnvironmentState.DELETING)).isTrue();
    }

    @Test
    void deleted_isTerminal() {
        assertThat(EnvironmentState.DELETED.isTerminal()).isTrue();
        assertThat(EnvironmentState.DELETED.allowedTransitions()).isEmpty();
    }

    @Test
    void running_cannotBeStartedAgain() {
        assertThat(EnvironmentState.RUNNING.canTransitionTo(EnvironmentState.PROVISIONING)).isFalse();
        assertThat(EnvironmentState.STOPPED.canTransitionTo(EnvironmentState.PROVISIONING)).isTrue();
    }

    @Test
    void failed_onlyLeadsToDeleting() {
        assertThat(EnvironmentState.FAILED.allowedTransitions()).containsExactly(EnvironmentState.DELETING);
    }

    @Test
    void pending_canNotJumpToRunning() {
        assertThat(EnvironmentState.PENDING.canTransitionTo(EnvironmentState.RUNNING)).isFalse();
    }
}
