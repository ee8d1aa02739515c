package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

public class GraphTimeoutException extends VarianceAnalysisException {

    public GraphTimeoutException(String sheet, String cellAddress, long nodesVisited) {
        super(IssueCategory.GRAPH_ERROR,
                String.format("Dependency graph for %s!%s exceeded the time limit after %d cells", sheet, cellAddress, nodesVisited),
                sheet, null, null);
    }

    public GraphTimeoutException(String message) {
        super(IssueCategory.GRAPH_ERROR, message, null, null, null);
    }
}
