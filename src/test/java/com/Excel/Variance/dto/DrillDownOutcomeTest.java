package com.Excel.Variance.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DrillDownOutcome Tests")
class DrillDownOutcomeTest {

    @Test
    @DisplayName("Should start in REQUESTED")
    void shouldStartRequested() {
        DrillDownOutcome outcome = new DrillDownOutcome();

        assertThat(outcome.getState()).isEqualTo(DrillDownState.REQUESTED);
        assertThat(outcome.getHistory()).containsExactly(DrillDownState.REQUESTED);
        assertThat(outcome.isAttributed()).isFalse();
    }

    @Test
    @DisplayName("Should record every state on the way to ATTRIBUTED")
    void shouldTrackHistory() {
        DrillDownResult result = new DrillDownResult("Revenue", "B2+B3", "B2+B3", 30.0, 35.0, 5.0, 5.0, 0.0, List.of());

        DrillDownOutcome outcome = new DrillDownOutcome()
                .transitionTo(DrillDownState.GRAPH_BUILDING)
                .transitionTo(DrillDownState.COMPONENT_MATCHING)
                .attribute(result);

        assertThat(outcome.isAttributed()).isTrue();
        assertThat(outcome.getResult()).isSameAs(result);
        assertThat(outcome.getHistory()).containsExactly(DrillDownState.REQUESTED, DrillDownState.GRAPH_BUILDING,
                DrillDownState.COMPONENT_MATCHING, DrillDownState.ATTRIBUTED);
    }

    @Test
    @DisplayName("Should carry the failure reason and message")
    void shouldFail() {
        DrillDownOutcome outcome = DrillDownOutcome.failed(FailureReason.NO_FORMULA, "hardcoded");

        assertThat(outcome.getState()).isEqualTo(DrillDownState.FAILED);
        assertThat(outcome.getFailureReason()).isEqualTo(FailureReason.NO_FORMULA);
        assertThat(outcome.getMessage()).isEqualTo("hardcoded");
        assertThat(outcome.getResult()).isNull();
    }

    @Test
    @DisplayName("Should refuse to leave a terminal state")
    void shouldRejectTransitionFromTerminal() {
        DrillDownOutcome outcome = DrillDownOutcome.failed(FailureReason.TIMEOUT, "slow");

        assertThatThrownBy(() -> outcome.transitionTo(DrillDownState.COMPONENT_MATCHING))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> outcome.fail(FailureReason.STRUCTURAL, "again"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should refuse to move backwards")
    void shouldRejectBackwardTransition() {
        DrillDownOutcome outcome = new DrillDownOutcome().transitionTo(DrillDownState.COMPONENT_MATCHING);

        assertThatThrownBy(() -> outcome.transitionTo(DrillDownState.GRAPH_BUILDING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("back");
    }
}
