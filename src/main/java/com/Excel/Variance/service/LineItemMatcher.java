package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.dto.AnalysisIssue;
import com.Excel.Variance.model.LineItem;
import com.Excel.Variance.model.MatchResult;
import com.Excel.Variance.model.MatchedPair;
import com.Excel.Variance.util.SimilarityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs old and new line items of one statement type by name.
 * <ol>
 *     <li>exact names, case-sensitive first and then ignoring case</li>
 *     <li>greedy fuzzy assignment in descending similarity, ties by old row then new row</li>
 *     <li>whatever is left becomes an old-only or new-only pair</li>
 * </ol>
 * Output order is fixed: old items in row order with their partners, then new-only items in row order.
 */
@Service
public class LineItemMatcher {

    private static final Logger logger = LoggerFactory.getLogger(LineItemMatcher.class);

    private final VarianceProperties properties;

    public LineItemMatcher(VarianceProperties properties) {
        this.properties = properties;
    }

    public MatchResult match(List<LineItem> oldItems, List<LineItem> newItems) {
        MatchedPair[] byOld = new MatchedPair[oldItems.size()];
        boolean[] newTaken = new boolean[newItems.size()];

        int exact = exactPass(oldItems, newItems, byOld, newTaken, true)
                + exactPass(oldItems, newItems, byOld, newTaken, false);
        int fuzzy = fuzzyPass(oldItems, newItems, byOld, newTaken);

        List<MatchedPair> pairs = new ArrayList<>();
        List<AnalysisIssue> issues = new ArrayList<>();

        for (int i = 0; i < oldItems.size(); i++) {
            if (byOld[i] == null) {
                LineItem item = oldItems.get(i);
                byOld[i] = MatchedPair.oldOnly(item);
                issues.add(AnalysisIssue.matching(
                        "Line item '" + item.getName() + "' exists only in the old model", item.getSheet(), item.getRow()));
            }
            pairs.add(byOld[i]);
        }
        for (int j = 0; j < newItems.size(); j++) {
            if (!newTaken[j]) {
                LineItem item = newItems.get(j);
                pairs.add(MatchedPair.newOnly(item));
                issues.add(AnalysisIssue.matching(
                        "Line item '" + item.getName() + "' exists only in the new model", item.getSheet(), item.getRow()));
            }
        }

        logger.info("Matched {} old / {} new line items: {} exact, {} fuzzy, {} unmatched",
                oldItems.size(), newItems.size(), exact, fuzzy, issues.size());
        return new MatchResult(pairs, issues);
    }

    private int exactPass(List<LineItem> oldItems, List<LineItem> newItems,
                          MatchedPair[] byOld, boolean[] newTaken, boolean caseSensitive) {
        int matched = 0;
        for (int i = 0; i < oldItems.size(); i++) {
            if (byOld[i] != null) {
                continue;
            }
            String oldName = oldItems.get(i).getName();
            for (int j = 0; j < newItems.size(); j++) {
                if (newTaken[j]) {
                    continue;
                }
                String newName = newItems.get(j).getName();
                if (caseSensitive ? oldName.equals(newName) : oldName.equalsIgnoreCase(newName)) {
                    byOld[i] = MatchedPair.exact(oldItems.get(i), newItems.get(j));
                    newTaken[j] = true;
                    matched++;
                    break;
                }
            }
        }
        return matched;
    }

    private int fuzzyPass(List<LineItem> oldItems, List<LineItem> newItems,
                          MatchedPair[] byOld, boolean[] newTaken) {
        double threshold = properties.getFuzzyThreshold();
        List<Candidate> candidates = new ArrayList<>();

        for (int i = 0; i < oldItems.size(); i++) {
            if (byOld[i] != null) {
                continue;
            }
            for (int j = 0; j < newItems.size(); j++) {
                if (newTaken[j]) {
                    continue;
                }
                double similarity = SimilarityUtils.similarity(oldItems.get(i).getName(), newItems.get(j).getName());
                if (similarity >= threshold) {
                    candidates.add(new Candidate(i, j, similarity, oldItems.get(i).getRow(), newItems.get(j).getRow()));
                }
            }
        }

        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.similarity).reversed()
                .thenComparingInt(c -> c.oldRow)
                .thenComparingInt(c -> c.newRow)
                .thenComparingInt(c -> c.oldIndex)
                .thenComparingInt(c -> c.newIndex));

        int matched = 0;
        for (Candidate candidate : candidates) {
            if (byOld[candidate.oldIndex] != null || newTaken[candidate.newIndex]) {
                continue;
            }
            LineItem oldItem = oldItems.get(candidate.oldIndex);
            LineItem newItem = newItems.get(candidate.newIndex);
            byOld[candidate.oldIndex] = MatchedPair.fuzzy(oldItem, newItem, candidate.similarity);
            newTaken[candidate.newIndex] = true;
            matched++;
            logger.debug("Fuzzy match '{}' -> '{}' ({})", oldItem.getName(), newItem.getName(), candidate.similarity);
        }
        return matched;
    }

    private static class Candidate {
        final int oldIndex;
        final int newIndex;
        final double similarity;
        final int oldRow;
        final int newRow;

        Candidate(int oldIndex, int newIndex, double similarity, int oldRow, int newRow) {
            this.oldIndex = oldIndex;
            this.newIndex = newIndex;
            this.similarity = similarity;
            this.oldRow = oldRow;
            this.newRow = newRow;
        }
    }
}
