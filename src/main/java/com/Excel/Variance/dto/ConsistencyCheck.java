package com.Excel.Variance.dto;

import com.Excel.Variance.model.StatementType;
import lombok.Value;

import java.util.List;

/**
 * How comparable the two models are. {@code compatibilityScore} is in [0, 1]: 0.4 for the same
 * statements on both sides, 0.3 for aligned periods and 0.3 scaled by naming consistency.
 */
@Value
public class ConsistencyCheck {
    boolean structureMatch;
    boolean periodAlignmentPossible;
    double namingConsistency;
    double compatibilityScore;
    List<StatementType> comparedStatements;
    List<String> issues;
    List<String> warnings;
    List<String> insights;
}
