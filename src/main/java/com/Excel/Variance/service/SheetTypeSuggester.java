package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.model.StatementType;
import com.Excel.Variance.model.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword scoring of sheets, used only to pre-fill the statement type selection the caller confirms.
 * Nothing in the analysis is routed by these guesses.
 */
@Service
public class SheetTypeSuggester {

    private static final Logger logger = LoggerFactory.getLogger(SheetTypeSuggester.class);

    private static final int NAME_WEIGHT = 3;
    private static final int LABEL_ROWS = 60;

    private static final Map<StatementType, List<String>> NAME_KEYWORDS = new EnumMap<>(StatementType.class);
    private static final Map<StatementType, List<String>> LABEL_KEYWORDS = new EnumMap<>(StatementType.class);

    static {
        NAME_KEYWORDS.put(StatementType.INCOME_STATEMENT,
                List.of("income", "p&l", "pnl", "profit", "loss", "revenue", "sales", "earnings"));
        NAME_KEYWORDS.put(StatementType.BALANCE_SHEET,
                List.of("balance", "bs", "assets", "liabilities", "equity"));
        NAME_KEYWORDS.put(StatementType.CASH_FLOW,
                List.of("cash", "flow", "cf", "operating", "investing", "financing"));

        LABEL_KEYWORDS.put(StatementType.INCOME_STATEMENT,
                List.of("revenue", "sales", "gross profit", "ebitda", "ebit", "net income", "earnings", "margin",
                        "cost of goods", "operating expenses"));
        LABEL_KEYWORDS.put(StatementType.BALANCE_SHEET,
                List.of("total assets", "current assets", "fixed assets", "liabilities", "equity", "retained earnings",
                        "debt", "stockholder", "inventory", "receivable"));
        LABEL_KEYWORDS.put(StatementType.CASH_FLOW,
                List.of("cash flow", "operating activities", "investing activities", "financing activities", "capex",
                        "free cash flow", "working capital", "depreciation"));
    }

    private final VarianceProperties properties;

    public SheetTypeSuggester(VarianceProperties properties) {
        this.properties = properties;
    }

    /**
     * Scores per sheet, in workbook order.
     */
    public Map<String, Map<StatementType, Integer>> score(Workbook workbook) {
        Map<String, Map<StatementType, Integer>> scores = new LinkedHashMap<>();
        for (Sheet sheet : workbook.getSheets()) {
            scores.put(sheet.getName(), score(sheet));
        }
        return scores;
    }

    /**
     * Best sheet per statement type. Highest score is assigned first, a sheet serves at most one type,
     * and types without any keyword hit are left out.
     */
    public Map<StatementType, String> suggest(Workbook workbook) {
        Map<String, Map<StatementType, Integer>> scores = score(workbook);

        List<Candidate> candidates = new ArrayList<>();
        int sheetIndex = 0;
        for (Map.Entry<String, Map<StatementType, Integer>> entry : scores.entrySet()) {
            for (Map.Entry<StatementType, Integer> score : entry.getValue().entrySet()) {
                if (score.getValue() > 0) {
                    candidates.add(new Candidate(entry.getKey(), score.getKey(), score.getValue(), sheetIndex));
                }
            }
            sheetIndex++;
        }
        candidates.sort(Comparator.comparingInt((Candidate c) -> c.score).reversed()
                .thenComparingInt(c -> c.sheetIndex)
                .thenComparing(c -> c.type));

        Map<StatementType, String> suggestion = new EnumMap<>(StatementType.class);
        List<String> usedSheets = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (!suggestion.containsKey(candidate.type) && !usedSheets.contains(candidate.sheetName)) {
                suggestion.put(candidate.type, candidate.sheetName);
                usedSheets.add(candidate.sheetName);
            }
        }

        logger.info("Suggested sheets for workbook '{}': {}", workbook.getName(), suggestion);
        return suggestion;
    }

    private Map<StatementType, Integer> score(Sheet sheet) {
        String name = sheet.getName().toLowerCase(Locale.ROOT);
        List<String> nameTokens = List.of(name.split("[^a-z0-9&]+"));

        StringBuilder labels = new StringBuilder();
        for (int row = 1; row <= Math.min(LABEL_ROWS, sheet.getMaxRow()); row++) {
            Object value = sheet.getRawValue(row, properties.getLabelColumn());
            if (value instanceof String) {
                labels.append(((String) value).toLowerCase(Locale.ROOT)).append('\n');
            }
        }
        String labelText = labels.toString();

        Map<StatementType, Integer> scores = new EnumMap<>(StatementType.class);
        for (StatementType type : StatementType.values()) {
            int score = 0;
            for (String keyword : NAME_KEYWORDS.get(type)) {
                // short keywords like "bs" only count as whole words
                if (keyword.length() <= 3 ? nameTokens.contains(keyword) : name.contains(keyword)) {
                    score += NAME_WEIGHT;
                }
            }
            for (String keyword : LABEL_KEYWORDS.get(type)) {
                if (labelText.contains(keyword)) {
                    score++;
                }
            }
            scores.put(type, score);
        }
        logger.debug("Sheet '{}' keyword scores: {}", sheet.getName(), scores);
        return scores;
    }

    private static class Candidate {
        final String sheetName;
        final StatementType type;
        final int score;
        final int sheetIndex;

        Candidate(String sheetName, StatementType type, int score, int sheetIndex) {
            this.sheetName = sheetName;
            this.type = type;
            this.score = score;
            this.sheetIndex = sheetIndex;
        }
    }
}
