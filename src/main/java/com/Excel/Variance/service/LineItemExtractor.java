package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.dto.AnalysisIssue;
import com.Excel.Variance.model.Cell;
import com.Excel.Variance.model.LineItem;
import com.Excel.Variance.model.LineItemExtraction;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.PeriodHeader;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.model.StatementType;
import com.Excel.Variance.util.CellValueUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the rows below a period header and emits one {@link LineItem} per labelled numeric row.
 * <p>
 * The stop rule is the same for every statement type: extraction ends after a run of empty rows.
 * A row is empty when it has neither a meaningful label nor a number in any period column.
 * Label-only rows (section headers) and number-only rows are skipped without touching the counter.
 */
@Service
public class LineItemExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LineItemExtractor.class);

    private final VarianceProperties properties;

    public LineItemExtractor(VarianceProperties properties) {
        this.properties = properties;
    }

    public LineItemExtraction extract(Sheet sheet, PeriodHeader header, StatementType statementType) {
        Map<String, Period> periods = uniquePeriods(header);
        int labelColumn = properties.getLabelColumn();
        int emptyRowLimit = properties.getEmptyRowLimit();

        List<LineItem> items = new ArrayList<>();
        List<AnalysisIssue> issues = new ArrayList<>();
        int consecutiveEmptyRows = 0;
        int row = header.getHeaderRow() + 1;

        for (; row <= sheet.getMaxRow(); row++) {
            if (consecutiveEmptyRows >= emptyRowLimit) {
                logger.debug("Sheet '{}': {} consecutive empty rows, stopping before row {}",
                        sheet.getName(), consecutiveEmptyRows, row);
                break;
            }

            Object label = sheet.getRawValue(row, labelColumn);
            boolean meaningfulLabel = CellValueUtils.isMeaningfulLabel(label);
            boolean hasNumber = hasNumericPeriodValue(sheet, row, periods);

            if (meaningfulLabel && hasNumber) {
                items.add(buildLineItem(sheet, row, (String) label, statementType, periods, issues));
                consecutiveEmptyRows = 0;
            } else if (!meaningfulLabel && !hasNumber) {
                consecutiveEmptyRows++;
            }
        }

        logger.info("Sheet '{}': extracted {} line items ({} data issues)", sheet.getName(), items.size(), issues.size());
        return new LineItemExtraction(items, issues);
    }

    /**
     * Period columns by label. A label repeated in the header keeps its first column.
     */
    private Map<String, Period> uniquePeriods(PeriodHeader header) {
        Map<String, Period> periods = new LinkedHashMap<>();
        for (Period period : header.getPeriods()) {
            Period existing = periods.putIfAbsent(period.getLabel(), period);
            if (existing != null) {
                logger.warn("Sheet '{}': period label '{}' repeated in column {}, using column {}",
                        header.getSheet(), period.getLabel(), period.getColumnIndex(), existing.getColumnIndex());
            }
        }
        return periods;
    }

    private boolean hasNumericPeriodValue(Sheet sheet, int row, Map<String, Period> periods) {
        for (Period period : periods.values()) {
            if (CellValueUtils.isNumeric(sheet.getRawValue(row, period.getColumnIndex()))) {
                return true;
            }
        }
        return false;
    }

    private LineItem buildLineItem(Sheet sheet, int row, String name, StatementType statementType,
                                   Map<String, Period> periods, List<AnalysisIssue> issues) {
        Map<String, Double> values = new LinkedHashMap<>();
        Map<String, String> formulas = new LinkedHashMap<>();

        for (Period period : periods.values()) {
            Cell cell = sheet.getCell(row, period.getColumnIndex());
            Object raw = cell != null ? cell.getRawValue() : null;
            Double value = CellValueUtils.toNumber(raw);
            values.put(period.getLabel(), value);

            if (value == null && !CellValueUtils.isBlank(raw)) {
                String message = String.format("Line item '%s' has non-numeric value '%s' for period '%s'; treated as no value",
                        name, raw, period.getLabel());
                logger.warn("Sheet '{}' row {}: {}", sheet.getName(), row, message);
                issues.add(AnalysisIssue.data(message, sheet.getName(), row, period.getColumnIndex()));
            }
            if (cell != null && cell.hasFormula()) {
                formulas.put(period.getLabel(), cell.getFormula());
            }
        }

        return new LineItem(name, sheet.getName(), row, statementType, values, formulas);
    }
}
