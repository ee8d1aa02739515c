package com.Excel.Variance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Cheap look at a line item's formula before a full drill-down is requested.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DrillDownPreview {

    public enum Complexity {
        SIMPLE,
        MODERATE,
        COMPLEX
    }

    String lineItemName;
    String period;
    String formula;
    boolean canDrillDown;
    int referenceCount;
    boolean hasCrossSheetReferences;
    boolean hasExternalReferences;
    String mainFunction;
    Complexity complexity;
    String parseWarning;
}
