package com.Excel.Variance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StatementType {
    INCOME_STATEMENT("income_statement"),
    BALANCE_SHEET("balance_sheet"),
    CASH_FLOW("cash_flow");

    private final String key;

    StatementType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static StatementType fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Statement type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StatementType type : values()) {
            if (type.key.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown statement type: " + value);
    }
}
