package com.Excel.Variance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one drill-down request. Moves REQUESTED, GRAPH_BUILDING, COMPONENT_MATCHING and ends in
 * ATTRIBUTED with a result or FAILED with a reason. Every state visited is kept in {@code history}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DrillDownOutcome {

    @JsonProperty("state")
    private DrillDownState state;

    @JsonProperty("history")
    private final List<DrillDownState> history = new ArrayList<>();

    @JsonProperty("failureReason")
    private FailureReason failureReason;

    @JsonProperty("message")
    private String message;

    @JsonProperty("result")
    private DrillDownResult result;

    @JsonProperty("issues")
    private final List<AnalysisIssue> issues = new ArrayList<>();

    public DrillDownOutcome() {
        this.state = DrillDownState.REQUESTED;
        this.history.add(DrillDownState.REQUESTED);
    }

    public static DrillDownOutcome failed(FailureReason reason, String message) {
        DrillDownOutcome outcome = new DrillDownOutcome();
        outcome.fail(reason, message);
        return outcome;
    }

    /**
     * Advance to a later state.
     *
     * @throws IllegalStateException when the outcome is already terminal or the move goes backwards
     */
    public DrillDownOutcome transitionTo(DrillDownState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Drill-down already " + state + ", cannot move to " + next);
        }
        if (next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Cannot move drill-down from " + state + " back to " + next);
        }
        state = next;
        history.add(next);
        return this;
    }

    public DrillDownOutcome fail(FailureReason reason, String message) {
        transitionTo(DrillDownState.FAILED);
        this.failureReason = reason;
        this.message = message;
        return this;
    }

    public DrillDownOutcome attribute(DrillDownResult result) {
        transitionTo(DrillDownState.ATTRIBUTED);
        this.result = result;
        return this;
    }

    public DrillDownOutcome addIssue(AnalysisIssue issue) {
        issues.add(issue);
        return this;
    }

    public DrillDownOutcome addIssues(List<AnalysisIssue> more) {
        issues.addAll(more);
        return this;
    }

    public DrillDownState getState() {
        return state;
    }

    public List<DrillDownState> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public FailureReason getFailureReason() {
        return failureReason;
    }

    public String getMessage() {
        return message;
    }

    public DrillDownResult getResult() {
        return result;
    }

    public List<AnalysisIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean isAttributed() {
        return state == DrillDownState.ATTRIBUTED;
    }
}
