package com.Excel.Variance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchKind {
    EXACT("exact"),
    FUZZY("fuzzy"),
    OLD_ONLY("old_only"),
    NEW_ONLY("new_only");

    private final String key;

    MatchKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public boolean isMatched() {
        return this == EXACT || this == FUZZY;
    }
}
