package com.Excel.Variance.dto;

public enum ComponentPresence {
    BOTH,
    OLD_ONLY,
    NEW_ONLY
}
