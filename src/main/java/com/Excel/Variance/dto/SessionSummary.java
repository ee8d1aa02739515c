package com.Excel.Variance.dto;

import com.Excel.Variance.model.StatementType;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
public class SessionSummary {
    String sessionId;
    Instant createdAt;
    String oldWorkbook;
    String newWorkbook;
    List<String> oldSheets;
    List<String> newSheets;
    Map<StatementType, String> suggestedSheets;
    Map<StatementType, String> suggestedNewSheets;
}
