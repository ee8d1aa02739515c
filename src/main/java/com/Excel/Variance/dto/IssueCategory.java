package com.Excel.Variance.dto;

public enum IssueCategory {
    STRUCTURAL_ERROR,
    MATCHING_WARNING,
    FORMULA_ERROR,
    GRAPH_ERROR,
    DATA_ERROR
}
