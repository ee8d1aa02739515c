package com.Excel.Variance.model;

import lombok.Value;

@Value
public class DrillDownKey {
    String sessionId;
    StatementType statementType;
    String lineItemName;
    String period;
}
