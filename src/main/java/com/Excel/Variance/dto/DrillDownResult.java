package com.Excel.Variance.dto;

import lombok.Value;

import java.util.List;

@Value
public class DrillDownResult {
    String lineItemName;
    String oldFormula;
    String newFormula;
    Double sourceValueOld;
    Double sourceValueNew;
    double totalVariance;
    double totalExplained;
    double unexplainedVariance;
    List<DrillDownComponent> components;
}
