package com.Excel.Variance.dto;

import com.Excel.Variance.model.MatchKind;
import lombok.Value;

/**
 * Top-level variance of one matched pair for one period.
 * {@code percentageVariance} is null unless {@code percentageState} is DEFINED.
 */
@Value
public class VarianceResult {
    String lineItemName;
    String newLineItemName;
    Double oldValue;
    Double newValue;
    Double absoluteVariance;
    Double percentageVariance;
    PercentageState percentageState;
    double matchConfidence;
    MatchKind matchKind;
    boolean drillDownAvailable;
}
