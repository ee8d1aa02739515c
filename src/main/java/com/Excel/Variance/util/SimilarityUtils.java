package com.Excel.Variance.util;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Name similarity used for line item matching.
 * Works on lower-cased alphanumeric tokens computed on the side, the labels themselves are never changed.
 */
public final class SimilarityUtils {

    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();

    private SimilarityUtils() {
    }

    /**
     * Blend of token-set Jaccard, edit-distance ratio and sorted-token edit ratio; the best of the three wins.
     * Returns a value in [0, 1].
     */
    public static double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        List<String> tokensA = tokens(a);
        List<String> tokensB = tokens(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0.0;
        }

        double jaccard = jaccard(tokensA, tokensB);
        double editRatio = editRatio(String.join(" ", tokensA), String.join(" ", tokensB));
        double sortedRatio = editRatio(sortedJoin(tokensA), sortedJoin(tokensB));

        return Math.max(jaccard, Math.max(editRatio, sortedRatio));
    }

    public static List<String> tokens(String text) {
        List<String> result = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}]+")) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }

    static double jaccard(List<String> a, List<String> b) {
        Set<String> setA = new LinkedHashSet<>(a);
        Set<String> setB = new LinkedHashSet<>(b);
        Set<String> union = new LinkedHashSet<>(setA);
        union.addAll(setB);
        setA.retainAll(setB);
        return union.isEmpty() ? 0.0 : (double) setA.size() / union.size();
    }

    static double editRatio(String a, String b) {
        int maxLength = Math.max(a.length(), b.length());
        if (maxLength == 0) {
            return 1.0;
        }
        int distance = LEVENSHTEIN.apply(a, b);
        return 1.0 - (double) distance / maxLength;
    }

    private static String sortedJoin(List<String> tokens) {
        List<String> sorted = new ArrayList<>(tokens);
        Collections.sort(sorted);
        return String.join(" ", sorted);
    }
}
