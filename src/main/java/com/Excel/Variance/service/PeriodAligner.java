package com.Excel.Variance.service;

import com.Excel.Variance.dto.PeriodAlignment;
import com.Excel.Variance.dto.PeriodComparison;
import com.Excel.Variance.model.Period;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lines up the period columns of the old and new model. Labels are compared verbatim first; otherwise
 * through a canonical key such as {@code 2024-Q1} computed on the side, so {@code "Q1 2024"} and
 * {@code "1Q24"} still pair up while both keep their original text.
 */
@Service
public class PeriodAligner {

    private static final Logger logger = LoggerFactory.getLogger(PeriodAligner.class);

    private static final String YEAR = "'?(\\d{4}|\\d{2})";
    private static final Pattern SUFFIX = Pattern.compile(
            "\\s*(?:[EAFPB]|Actuals?|Estimated?|Est\\.?|Forecast|Budget|Plan)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern QUARTER_FIRST = Pattern.compile("Q([1-4])\\s*[-/]?\\s*(?:FY\\s*)?" + YEAR, Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_FIRST = Pattern.compile("(?:FY\\s*)?([1-4])Q\\s*[-']?\\s*" + YEAR, Pattern.CASE_INSENSITIVE);
    private static final Pattern FISCAL_QUARTER = Pattern.compile("FY\\s*" + YEAR + "\\s*[-/]?\\s*Q([1-4])", Pattern.CASE_INSENSITIVE);
    private static final Pattern HALF = Pattern.compile("(?:H([12])|([12])H)\\s*[-/]?\\s*(?:FY\\s*)?" + YEAR, Pattern.CASE_INSENSITIVE);
    private static final Pattern FISCAL_YEAR = Pattern.compile("(?:FY|CY)\\s*" + YEAR, Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN_YEAR = Pattern.compile("(\\d{4})");
    private static final Pattern MONTH_NAME = Pattern.compile("([a-z]{3})[a-z]*\\.?\\s*[-/]?\\s*" + YEAR, Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_NUMERIC = Pattern.compile("(0?[1-9]|1[0-2])/" + YEAR);
    private static final Pattern ISO_MONTH = Pattern.compile("(\\d{4})-(0[1-9]|1[0-2])");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private static final List<String> MONTHS = List.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");

    public PeriodAlignment align(List<Period> oldPeriods, List<Period> newPeriods) {
        List<String> oldLabels = distinctLabels(oldPeriods);
        List<String> newLabels = distinctLabels(newPeriods);

        String[] partner = new String[newLabels.size()];
        PeriodComparison.Alignment[] kind = new PeriodComparison.Alignment[newLabels.size()];
        Set<String> usedOld = new LinkedHashSet<>();

        for (int j = 0; j < newLabels.size(); j++) {
            if (oldLabels.contains(newLabels.get(j))) {
                partner[j] = newLabels.get(j);
                kind[j] = PeriodComparison.Alignment.EXACT;
                usedOld.add(newLabels.get(j));
            }
        }

        for (int j = 0; j < newLabels.size(); j++) {
            if (partner[j] != null) {
                continue;
            }
            Optional<String> key = canonicalKey(newLabels.get(j));
            if (key.isEmpty()) {
                continue;
            }
            for (String oldLabel : oldLabels) {
                if (!usedOld.contains(oldLabel) && key.equals(canonicalKey(oldLabel))) {
                    partner[j] = oldLabel;
                    kind[j] = PeriodComparison.Alignment.EQUIVALENT;
                    usedOld.add(oldLabel);
                    break;
                }
            }
        }

        List<PeriodComparison> aligned = new ArrayList<>();
        List<String> newOnly = new ArrayList<>();
        for (int j = 0; j < newLabels.size(); j++) {
            if (partner[j] != null) {
                aligned.add(new PeriodComparison(partner[j], newLabels.get(j),
                        canonicalKey(newLabels.get(j)).orElse(null), kind[j]));
            } else {
                newOnly.add(newLabels.get(j));
            }
        }
        List<String> oldOnly = new ArrayList<>();
        for (String oldLabel : oldLabels) {
            if (!usedOld.contains(oldLabel)) {
                oldOnly.add(oldLabel);
            }
        }

        logger.debug("Period alignment: {} aligned, {} old-only, {} new-only", aligned.size(), oldOnly.size(), newOnly.size());
        return new PeriodAlignment(aligned, oldOnly, newOnly);
    }

    /**
     * Canonical key of a period label, e.g. {@code 2024-Q1}, {@code 2024-H2}, {@code 2024-FY}, {@code 2024-M03}.
     * Estimate and actual markers are ignored. Empty when the label has no recognisable shape.
     */
    public Optional<String> canonicalKey(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String text = SUFFIX.matcher(label.trim()).replaceFirst("").trim();
        Matcher m;

        if ((m = QUARTER_FIRST.matcher(text)).matches() || (m = NUMBER_FIRST.matcher(text)).matches()) {
            return Optional.of(year(m.group(2)) + "-Q" + m.group(1));
        }
        if ((m = FISCAL_QUARTER.matcher(text)).matches()) {
            return Optional.of(year(m.group(1)) + "-Q" + m.group(2));
        }
        if ((m = HALF.matcher(text)).matches()) {
            String half = m.group(1) != null ? m.group(1) : m.group(2);
            return Optional.of(year(m.group(3)) + "-H" + half);
        }
        if ((m = FISCAL_YEAR.matcher(text)).matches() || (m = PLAIN_YEAR.matcher(text)).matches()) {
            return Optional.of(year(m.group(1)) + "-FY");
        }
        if ((m = ISO_MONTH.matcher(text)).matches()) {
            return Optional.of(m.group(1) + "-M" + m.group(2));
        }
        if ((m = MONTH_NUMERIC.matcher(text)).matches()) {
            return Optional.of(year(m.group(2)) + "-M" + String.format("%02d", Integer.parseInt(m.group(1))));
        }
        if ((m = MONTH_NAME.matcher(text)).matches()) {
            int month = MONTHS.indexOf(m.group(1).toLowerCase(Locale.ROOT));
            if (month >= 0) {
                return Optional.of(year(m.group(2)) + "-M" + String.format("%02d", month + 1));
            }
        }
        if (ISO_DATE.matcher(text).matches()) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    private static int year(String digits) {
        int value = Integer.parseInt(digits);
        return digits.length() == 2 ? 2000 + value : value;
    }

    private static List<String> distinctLabels(List<Period> periods) {
        Set<String> labels = new LinkedHashSet<>();
        for (Period period : periods) {
            labels.add(period.getLabel());
        }
        return new ArrayList<>(labels);
    }
}
