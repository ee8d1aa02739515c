package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

/**
 * Base exception of the analysis engine. Carries the Excel location it originated from
 * so the caller can point at the offending cell.
 */
public class VarianceAnalysisException extends RuntimeException {

    private final IssueCategory category;
    private final String sheet;
    private final Integer row;
    private final Integer column;

    public VarianceAnalysisException(IssueCategory category, String message, String sheet, Integer row, Integer column) {
        super(message);
        this.category = category;
        this.sheet = sheet;
        this.row = row;
        this.column = column;
    }

    public VarianceAnalysisException(IssueCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.sheet = null;
        this.row = null;
        this.column = null;
    }

    public IssueCategory getCategory() {
        return category;
    }

    public String getSheet() {
        return sheet;
    }

    public Integer getRow() {
        return row;
    }

    public Integer getColumn() {
        return column;
    }

    /**
     * Short machine-readable code, e.g. "NoPeriodHeaderFound".
     */
    public String getCode() {
        String simple = getClass().getSimpleName();
        return simple.endsWith("Exception") ? simple.substring(0, simple.length() - "Exception".length()) : simple;
    }
}
