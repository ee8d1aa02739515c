package com.Excel.Variance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * One period seen from both models. A side is null when the period exists only in the other model.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PeriodComparison {

    public enum Alignment {
        EXACT,
        EQUIVALENT,
        OLD_ONLY,
        NEW_ONLY
    }

    String oldLabel;
    String newLabel;
    String canonicalKey;
    Alignment alignment;

    public boolean isAligned() {
        return oldLabel != null && newLabel != null;
    }
}
