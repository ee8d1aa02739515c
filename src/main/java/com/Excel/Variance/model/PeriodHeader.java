package com.Excel.Variance.model;

import lombok.Value;

import java.util.List;

/**
 * Detected period header of a sheet: the header row and its periods in column order.
 */
@Value
public class PeriodHeader {
    String sheet;
    int headerRow;
    List<Period> periods;

    public List<String> getLabels() {
        return periods.stream().map(Period::getLabel).collect(java.util.stream.Collectors.toList());
    }
}
