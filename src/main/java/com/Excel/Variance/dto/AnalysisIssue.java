package com.Excel.Variance.dto;

import com.Excel.Variance.exception.VarianceAnalysisException;
import com.Excel.Variance.util.CellAddressUtils;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data Transfer Object for a contained failure or warning, with the Excel location it came from
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisIssue {

    @JsonProperty("category")
    private IssueCategory category;

    @JsonProperty("code")
    private String code;

    @JsonProperty("message")
    private String message;

    @JsonProperty("sheet")
    private String sheet;

    @JsonProperty("row")
    private Integer row;

    @JsonProperty("column")
    private Integer column;

    @JsonProperty("cell")
    private String cellAddress;

    // Constructors
    public AnalysisIssue() {
    }

    public AnalysisIssue(IssueCategory category, String code, String message,
                         String sheet, Integer row, Integer column) {
        this.category = category;
        this.code = code;
        this.message = message;
        this.sheet = sheet;
        this.row = row;
        this.column = column;
        if (row != null && column != null && CellAddressUtils.isValid(column, row)) {
            this.cellAddress = CellAddressUtils.toAddress(column, row);
        }
    }

    public static AnalysisIssue from(VarianceAnalysisException e) {
        return new AnalysisIssue(e.getCategory(), e.getCode(), e.getMessage(),
                e.getSheet(), e.getRow(), e.getColumn());
    }

    public static AnalysisIssue structural(String code, String message, String sheet) {
        return new AnalysisIssue(IssueCategory.STRUCTURAL_ERROR, code, message, sheet, null, null);
    }

    public static AnalysisIssue matching(String message, String sheet, int row) {
        return new AnalysisIssue(IssueCategory.MATCHING_WARNING, "UnmatchedLineItem", message, sheet, row, null);
    }

    public static AnalysisIssue data(String message, String sheet, int row, int column) {
        return new AnalysisIssue(IssueCategory.DATA_ERROR, "NonNumericValue", message, sheet, row, column);
    }

    public static AnalysisIssue formula(String code, String message, String sheet, Integer row, Integer column) {
        return new AnalysisIssue(IssueCategory.FORMULA_ERROR, code, message, sheet, row, column);
    }

    public static AnalysisIssue graph(String code, String message, String sheet, Integer row, Integer column) {
        return new AnalysisIssue(IssueCategory.GRAPH_ERROR, code, message, sheet, row, column);
    }

    // Getters and Setters
    public IssueCategory getCategory() {
        return category;
    }

    public void setCategory(IssueCategory category) {
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getSheet() {
        return sheet;
    }

    public void setSheet(String sheet) {
        this.sheet = sheet;
    }

    public Integer getRow() {
        return row;
    }

    public void setRow(Integer row) {
        this.row = row;
    }

    public Integer getColumn() {
        return column;
    }

    public void setColumn(Integer column) {
        this.column = column;
    }

    public String getCellAddress() {
        return cellAddress;
    }

    public void setCellAddress(String cellAddress) {
        this.cellAddress = cellAddress;
    }

    @Override
    public String toString() {
        return String.format("AnalysisIssue{category=%s, code='%s', sheet='%s', cell='%s', message='%s'}",
                category, code, sheet, cellAddress, message);
    }
}
