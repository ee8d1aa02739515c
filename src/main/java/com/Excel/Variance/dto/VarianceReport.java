package com.Excel.Variance.dto;

import com.Excel.Variance.model.MatchedPair;
import com.Excel.Variance.model.StatementType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * Variances of one statement for the selected period. {@code error} is set when the statement could
 * not be analysed at all; per-item problems only show up in {@code issues}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VarianceReport {
    StatementType statementType;
    String period;
    String oldPeriod;
    String newPeriod;
    List<MatchedPair> pairs;
    List<VarianceResult> variances;
    List<AnalysisIssue> issues;
    String error;

    public static VarianceReport failed(StatementType type, String period, List<AnalysisIssue> issues, String error) {
        return new VarianceReport(type, period, null, null, List.of(), List.of(), issues, error);
    }
}
