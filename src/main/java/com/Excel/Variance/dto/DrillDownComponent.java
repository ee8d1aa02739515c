package com.Excel.Variance.dto;

import lombok.Value;

/**
 * One operand of the drilled formula with its share of the variance. Missing values count as zero
 * in {@code varianceContribution}.
 */
@Value
public class DrillDownComponent {
    String name;
    String cellRef;
    String oldCellRef;
    String newCellRef;
    Double oldValue;
    Double newValue;
    double varianceContribution;
    boolean leaf;
    boolean hasFormula;
    ComponentPresence presence;
}
