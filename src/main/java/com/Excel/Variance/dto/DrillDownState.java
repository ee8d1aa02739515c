package com.Excel.Variance.dto;

public enum DrillDownState {
    REQUESTED,
    GRAPH_BUILDING,
    COMPONENT_MATCHING,
    ATTRIBUTED,
    FAILED;

    public boolean isTerminal() {
        return this == ATTRIBUTED || this == FAILED;
    }
}
