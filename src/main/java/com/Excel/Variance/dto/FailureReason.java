package com.Excel.Variance.dto;

public enum FailureReason {
    /** the line item cell is a plain value; nothing to drill into */
    NO_FORMULA,
    CIRCULAR_REFERENCE,
    PARSE_ERROR,
    TIMEOUT,
    LINE_ITEM_NOT_FOUND,
    /** sheet or period missing */
    STRUCTURAL,
    /** unexpected failure inside the engine, see the server log */
    INTERNAL_ERROR
}
