package com.Excel.Variance.dto;

public enum PercentageState {
    DEFINED,
    /** old value is zero, so no percentage exists */
    UNDEFINED_ZERO_BASE,
    /** a value is missing on one side */
    NOT_AVAILABLE
}
