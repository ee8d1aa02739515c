package com.Excel.Variance.service;

import com.Excel.Variance.model.PeriodType;
import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One recognised shape of period label. A named group {@code year}, when present, must fall in the
 * configured year range for the label to count.
 */
@Value
public class PeriodPattern {
    String name;
    Pattern pattern;
    PeriodType type;

    public static PeriodPattern of(String name, String regex, PeriodType type) {
        return new PeriodPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type);
    }

    /**
     * Full match of the trimmed label; null when it does not match.
     */
    public Matcher match(String label) {
        Matcher m = pattern.matcher(label.trim());
        return m.matches() ? m : null;
    }

    /**
     * Four digit year captured by a successful match, or null when the pattern has none.
     */
    public Integer year(Matcher match) {
        if (!pattern.pattern().contains("(?<year>")) {
            return null;
        }
        String year = match.group("year");
        return year != null ? Integer.valueOf(year) : null;
    }
}
