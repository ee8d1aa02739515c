package com.Excel.Variance.graph;

import lombok.Value;

@Value
public class GraphFinding {

    public enum Type {
        CIRCULAR_REFERENCE,
        DEPTH_TRUNCATED,
        RANGE_TRUNCATED,
        PARSE_WARNING,
        EXTERNAL_REFERENCE,
        MISSING_SHEET
    }

    Type type;
    String sheet;
    int row;
    int col;
    String message;
}
