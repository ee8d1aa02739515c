package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.exception.NoPeriodHeaderFoundException;
import com.Excel.Variance.model.Cell;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.PeriodHeader;
import com.Excel.Variance.model.PeriodType;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.util.CellValueUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Finds the row of a sheet that carries the period labels.
 * Labels are returned exactly as written; no canonicalisation happens here.
 */
@Service
public class PeriodDetector {

    private static final Logger logger = LoggerFactory.getLogger(PeriodDetector.class);

    private static final String YEAR = "(?:(?<year>\\d{4})|'?\\d{2})";
    private static final String SUFFIX = "(?:\\s*(?:[EAFPB]|Actuals?|Estimated?|Est\\.?|Forecast|Budget|Plan))?";

    static final List<PeriodPattern> DEFAULT_PATTERNS = List.of(
            // Q1, Q1 2024, Q1-24, Q1 FY24, Q3'25E
            PeriodPattern.of("quarter", "Q[1-4](?:\\s*[-/]?\\s*(?:FY\\s*)?" + YEAR + ")?" + SUFFIX, PeriodType.QUARTER),
            // 1Q24, 1Q2024E, FY1Q25
            PeriodPattern.of("quarter-number-first", "(?:FY\\s*)?[1-4]Q\\s*[-']?\\s*" + YEAR + SUFFIX, PeriodType.QUARTER),
            // FY24 Q1, FY2024-Q3
            PeriodPattern.of("fiscal-year-quarter", "FY\\s*" + YEAR + "\\s*[-/]?\\s*Q[1-4]" + SUFFIX, PeriodType.QUARTER),
            // H1 2024, 2H24
            PeriodPattern.of("half-year", "(?:H[12]|[12]H)(?:\\s*[-/]?\\s*(?:FY\\s*)?" + YEAR + ")?" + SUFFIX, PeriodType.HALF_YEAR),
            // FY2024, FY 2024E, CY2024, FY24
            PeriodPattern.of("fiscal-year", "(?:FY|CY)\\s*" + YEAR + SUFFIX, PeriodType.YEAR),
            // 2024, 2024E, 2024A, 2024 Actual
            PeriodPattern.of("year", "(?<year>\\d{4})" + SUFFIX, PeriodType.YEAR),
            // Mar 2024, Mar-24, March 2024E
            PeriodPattern.of("month-name", "(?:" + PeriodTemplateService.MONTH_NAMES + ")[a-z]*\\.?\\s*[-/]?\\s*" + YEAR + SUFFIX,
                    PeriodType.MONTH),
            // 3/2024, 03/24
            PeriodPattern.of("month-numeric", "(?:0?[1-9]|1[0-2])/" + YEAR + SUFFIX, PeriodType.MONTH),
            // 2024-03
            PeriodPattern.of("iso-month", "(?<year>\\d{4})-(?:0[1-9]|1[0-2])" + SUFFIX, PeriodType.MONTH),
            // 2024-03-31 (date cells), 3/31/2024
            PeriodPattern.of("iso-date", "(?<year>\\d{4})-\\d{2}-\\d{2}", PeriodType.DATE),
            PeriodPattern.of("us-date", "\\d{1,2}/\\d{1,2}/" + YEAR, PeriodType.DATE)
    );

    private final VarianceProperties properties;

    public PeriodDetector(VarianceProperties properties) {
        this.properties = properties;
    }

    public PeriodHeader detect(Sheet sheet) {
        return detect(sheet, List.of());
    }

    /**
     * Pick the header row among the first rows of the sheet: most period labels wins, earliest row on ties.
     *
     * @param extraPatterns compiled user templates, tried before the built-in patterns
     * @throws NoPeriodHeaderFoundException when no scanned row has enough period labels
     */
    public PeriodHeader detect(Sheet sheet, List<PeriodPattern> extraPatterns) {
        int scanRows = properties.getHeaderScanRows();
        int minimum = properties.getMinPeriodCells();
        logger.debug("Scanning first {} rows of sheet '{}' for a period header", scanRows, sheet.getName());

        int bestRow = -1;
        List<Period> best = List.of();

        for (int row = 1; row <= Math.min(scanRows, sheet.getMaxRow()); row++) {
            List<Period> periods = periodsInRow(sheet, row, extraPatterns);
            logger.debug("Sheet '{}' row {}: {} period labels", sheet.getName(), row, periods.size());
            if (periods.size() >= minimum && periods.size() > best.size()) {
                bestRow = row;
                best = periods;
            }
        }

        if (bestRow < 0) {
            logger.warn("No period header found in sheet '{}'", sheet.getName());
            throw new NoPeriodHeaderFoundException(sheet.getName(), scanRows, minimum);
        }

        logger.info("Sheet '{}': period header at row {} with {} periods", sheet.getName(), bestRow, best.size());
        return new PeriodHeader(sheet.getName(), bestRow, best);
    }

    private List<Period> periodsInRow(Sheet sheet, int row, List<PeriodPattern> extraPatterns) {
        List<Period> periods = new ArrayList<>();
        for (Cell cell : sheet.getRow(row)) {
            // the label column never holds a period
            if (cell.getCol() == properties.getLabelColumn()) {
                continue;
            }
            Optional<PeriodType> type = classifyCell(cell.getRawValue(), extraPatterns);
            if (type.isPresent()) {
                periods.add(new Period(CellValueUtils.toHeaderText(cell.getRawValue()), cell.getCol(),
                        sheet.getName(), row, type.get()));
            }
        }
        return periods;
    }

    public Optional<PeriodType> classify(String label) {
        return classify(label, List.of());
    }

    /**
     * Period type of a label, or empty when it is not a period.
     */
    public Optional<PeriodType> classify(String label, List<PeriodPattern> extraPatterns) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        List<PeriodPattern> patterns = new ArrayList<>(extraPatterns);
        patterns.addAll(DEFAULT_PATTERNS);

        for (PeriodPattern pattern : patterns) {
            Matcher m = pattern.match(label);
            if (m == null) {
                continue;
            }
            Integer year = pattern.year(m);
            if (year != null && !isYearInRange(year)) {
                continue;
            }
            return Optional.of(pattern.getType());
        }
        return Optional.empty();
    }

    private Optional<PeriodType> classifyCell(Object rawValue, List<PeriodPattern> extraPatterns) {
        if (rawValue instanceof Number) {
            // only whole numbers that look like a year, e.g. a 2024 typed as a number
            double d = ((Number) rawValue).doubleValue();
            if (d == Math.rint(d) && isYearInRange((int) d)) {
                return Optional.of(PeriodType.YEAR);
            }
            return Optional.empty();
        }
        if (rawValue instanceof String) {
            return classify((String) rawValue, extraPatterns);
        }
        return Optional.empty();
    }

    private boolean isYearInRange(int year) {
        return year >= properties.getMinYear() && year <= properties.getMaxYear();
    }
}
