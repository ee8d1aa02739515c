package com.Excel.Variance.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One named row of a statement sheet. Values are keyed by period label in column order;
 * a null value means the period cell held no number.
 */
@Value
public class LineItem {
    String name; // verbatim label text
    String sheet;
    int row;
    StatementType statementType;
    Map<String, Double> values;
    Map<String, String> formulas;
    String formula; // first formula in period order, if any

    public LineItem(String name, String sheet, int row, StatementType statementType,
                    Map<String, Double> values, Map<String, String> formulas) {
        this.name = name;
        this.sheet = sheet;
        this.row = row;
        this.statementType = statementType;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.formulas = Collections.unmodifiableMap(new LinkedHashMap<>(formulas));
        this.formula = this.formulas.values().stream().findFirst().orElse(null);
    }

    public Double getValue(String periodLabel) {
        return values.get(periodLabel);
    }

    public boolean hasPeriod(String periodLabel) {
        return values.containsKey(periodLabel);
    }

    public String getFormula(String periodLabel) {
        return formulas.get(periodLabel);
    }
}
