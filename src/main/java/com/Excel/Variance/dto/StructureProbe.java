package com.Excel.Variance.dto;

import com.Excel.Variance.model.LineItem;
import com.Excel.Variance.model.ModelSide;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.StatementType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.util.List;

/**
 * Periods and line items found on one selected sheet. {@code headerRow} is null when detection failed;
 * the reason is then among the issues.
 */
@Value
public class StructureProbe {
    ModelSide side;
    StatementType statementType;
    String sheetName;
    Integer headerRow;
    List<Period> periods;
    List<LineItem> lineItems;
    List<AnalysisIssue> issues;

    public static StructureProbe failed(ModelSide side, StatementType type, String sheetName, AnalysisIssue issue) {
        return new StructureProbe(side, type, sheetName, null, List.of(), List.of(), List.of(issue));
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return headerRow != null;
    }

    public Period findPeriod(String label) {
        if (label == null) {
            return null;
        }
        return periods.stream().filter(p -> p.getLabel().equals(label)).findFirst().orElse(null);
    }
}
