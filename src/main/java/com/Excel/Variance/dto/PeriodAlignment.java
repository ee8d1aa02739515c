package com.Excel.Variance.dto;

import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class PeriodAlignment {
    List<PeriodComparison> aligned;
    List<String> oldOnly;
    List<String> newOnly;

    /**
     * Comparison for a selected label, looked up on the new side first.
     */
    public Optional<PeriodComparison> resolve(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (PeriodComparison comparison : aligned) {
            if (label.equals(comparison.getNewLabel())) {
                return Optional.of(comparison);
            }
        }
        for (PeriodComparison comparison : aligned) {
            if (label.equals(comparison.getOldLabel())) {
                return Optional.of(comparison);
            }
        }
        if (newOnly.contains(label)) {
            return Optional.of(new PeriodComparison(null, label, null, PeriodComparison.Alignment.NEW_ONLY));
        }
        if (oldOnly.contains(label)) {
            return Optional.of(new PeriodComparison(label, null, null, PeriodComparison.Alignment.OLD_ONLY));
        }
        return Optional.empty();
    }
}
