package com.Excel.Variance.model;

import com.Excel.Variance.dto.AnalysisIssue;
import lombok.Value;

import java.util.List;

@Value
public class MatchResult {
    List<MatchedPair> pairs;
    List<AnalysisIssue> issues;
}
