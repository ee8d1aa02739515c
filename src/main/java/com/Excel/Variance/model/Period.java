package com.Excel.Variance.model;

import lombok.Value;

/**
 * A period column. The label is the header cell text exactly as written in the sheet.
 */
@Value
public class Period {
    String label;
    int columnIndex; // 1-based
    String sheet;
    int headerRow;   // 1-based
    PeriodType periodType;
}
