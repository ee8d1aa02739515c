package com.Excel.Variance.model;

import com.Excel.Variance.util.CellAddressUtils;
import com.Excel.Variance.util.CellValueUtils;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

@Value
public class Cell {
    String sheet;
    int row;         // 1-based
    int col;         // 1-based, A = 1
    Object rawValue; // Double, String, Boolean or null; cached result for formula cells
    String formula;  // without the leading '=', null for constants

    public Cell(String sheet, int row, int col, Object rawValue, String formula) {
        this.sheet = sheet;
        this.row = row;
        this.col = col;
        this.rawValue = rawValue;
        this.formula = formula != null && formula.startsWith("=") ? formula.substring(1) : formula;
    }

    public static Cell value(String sheet, int row, int col, Object rawValue) {
        return new Cell(sheet, row, col, rawValue, null);
    }

    public static Cell formula(String sheet, int row, int col, String formula, Object cachedValue) {
        return new Cell(sheet, row, col, cachedValue, formula);
    }

    @JsonIgnore
    public boolean hasFormula() {
        return formula != null && !formula.isBlank();
    }

    @JsonIgnore
    public Double getNumericValue() {
        return CellValueUtils.toNumber(rawValue);
    }

    public String getAddress() {
        return CellAddressUtils.toAddress(col, row);
    }

    @JsonIgnore
    public String getQualifiedAddress() {
        return CellAddressUtils.qualify(sheet, getAddress());
    }
}
