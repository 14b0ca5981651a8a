package com.example.cronscheduler.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunStatus Enum Tests")
class RunStatusTest {

    @Test
    @DisplayName("Terminal states should be identified correctly")
    void terminalStatesShouldBeIdentified() {
        assertThat(RunStatus.SUCCEEDED.isTerminal()).isTrue();
        assertThat(RunStatus.FAILED_TERMINAL.isTerminal()).isTrue();

        assertThat(RunStatus.PENDING.isTerminal()).isFalse();
        assertThat(RunStatus.CLAIMED.isTerminal()).isFalse();
        assertThat(RunStatus.EXECUTING.isTerminal()).isFalse();
        assertThat(RunStatus.RETRY_SCHEDULED.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Active list should hold exactly the non-terminal states")
    void activeListShouldHoldNonTerminalStates() {
        for (var status : RunStatus.values()) {
            assertThat(RunStatus.ACTIVE.contains(status)).isEqualTo(status.isActive());
        }
        assertThat(RunStatus.LEASED).containsExactly(RunStatus.CLAIMED, RunStatus.EXECUTING);
    }

    @Test
    @DisplayName("Terminal states should have no successors")
    void terminalStatesShouldHaveNoSuccessors() {
        assertThat(RunStatus.SUCCEEDED.allowedTransitions()).isEmpty();
        assertThat(RunStatus.FAILED_TERMINAL.allowedTransitions()).isEmpty();
    }

    @Test
    @DisplayName("Should allow the lifecycle transitions")
    void shouldAllowLifecycleTransitions() {
        assertThat(RunStatus.PENDING.canTransitionTo(RunStatus.CLAIMED)).isTrue();
        assertThat(RunStatus.CLAIMED.canTransitionTo(RunStatus.EXECUTING)).isTrue();
        assertThat(RunStatus.EXECUTING.canTransitionTo(RunStatus.SUCCEEDED)).isTrue();
        assertThat(RunStatus.EXECUTING.canTransitionTo(RunStatus.RETRY_SCHEDULED)).isTrue();
        assertThat(RunStatus.RETRY_SCHEDULED.canTransitionTo(RunStatus.CLAIMED)).isTrue();
        // lease recovery
        assertThat(RunStatus.EXECUTING.canTransitionTo(RunStatus.PENDING)).isTrue();
        assertThat(RunStatus.CLAIMED.canTransitionTo(RunStatus.FAILED_TERMINAL)).isTrue();
    }

    @Test
    @DisplayName("Should reject shortcuts through the lifecycle")
    void shouldRejectShortcuts() {
        assertThat(RunStatus.PENDING.canTransitionTo(RunStatus.EXECUTING)).isFalse();
        assertThat(RunStatus.CLAIMED.canTransitionTo(RunStatus.SUCCEEDED)).isFalse();
        assertThat(RunStatus.RETRY_SCHEDULED.canTransitionTo(RunStatus.EXECUTING)).isFalse();
        assertThat(RunStatus.SUCCEEDED.canTransitionTo(RunStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("Should lookup by code")
    void shouldLookupByCode() {
        assertThat(RunStatus.fromCode("pending")).isEqualTo(RunStatus.PENDING);
        assertThat(RunStatus.fromCode("retry_scheduled")).isEqualTo(RunStatus.RETRY_SCHEDULED);
        assertThat(RunStatus.fromCode("failed_terminal")).isEqualTo(RunStatus.FAILED_TERMINAL);
    }

    @Test
    @DisplayName("Should throw for unknown code")
    void shouldThrowForUnknownCode() {
        assertThatThrownBy(() -> RunStatus.fromCode("nonexistent")).isInstanceOf(IllegalArgumentException.class);
    }
}
