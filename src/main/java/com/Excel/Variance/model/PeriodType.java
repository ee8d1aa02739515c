package com.Excel.Variance.model;

public enum PeriodType {
    QUARTER,
    HALF_YEAR,
    YEAR,
    MONTH,
    DATE,
    OTHER
}
