package com.Excel.Variance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * Association of an old and a new line item. One side is absent for old_only / new_only pairs.
 */
@Value
public class MatchedPair {
    LineItem oldItem;
    LineItem newItem;
    double confidence;
    MatchKind matchKind;

    public static MatchedPair exact(LineItem oldItem, LineItem newItem) {
        return new MatchedPair(oldItem, newItem, 1.0, MatchKind.EXACT);
    }

    public static MatchedPair fuzzy(LineItem oldItem, LineItem newItem, double similarity) {
        return new MatchedPair(oldItem, newItem, similarity, MatchKind.FUZZY);
    }

    public static MatchedPair oldOnly(LineItem oldItem) {
        return new MatchedPair(oldItem, null, 0.0, MatchKind.OLD_ONLY);
    }

    public static MatchedPair newOnly(LineItem newItem) {
        return new MatchedPair(null, newItem, 0.0, MatchKind.NEW_ONLY);
    }

    /**
     * Name shown for the pair: the old label when there is one, otherwise the new label.
     */
    @JsonIgnore
    public String getDisplayName() {
        return oldItem != null ? oldItem.getName() : newItem.getName();
    }

    public boolean hasName(String name) {
        return (oldItem != null && oldItem.getName().equals(name))
                || (newItem != null && newItem.getName().equals(name));
    }
}
