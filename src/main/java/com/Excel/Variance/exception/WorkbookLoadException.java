package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

public class WorkbookLoadException extends VarianceAnalysisException {

    public WorkbookLoadException(String message, Throwable cause) {
        super(IssueCategory.STRUCTURAL_ERROR, message, cause);
    }
}
