package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

public class CircularReferenceException extends VarianceAnalysisException {

    public CircularReferenceException(String sheet, int row, int column, String detail) {
        super(IssueCategory.GRAPH_ERROR, detail, sheet, row, column);
    }
}
