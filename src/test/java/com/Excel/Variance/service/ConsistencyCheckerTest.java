package com.Excel.Variance.service;

import com.Excel.Variance.dto.AnalysisIssue;
import com.Excel.Variance.dto.ConsistencyCheck;
import com.Excel.Variance.dto.StructureProbe;
import com.Excel.Variance.model.LineItem;
import com.Excel.Variance.model.MatchResult;
import com.Excel.Variance.model.MatchedPair;
import com.Excel.Variance.model.ModelSide;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.PeriodType;
import com.Excel.Variance.model.StatementType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ConsistencyChecker Tests")
class ConsistencyCheckerTest {

    private static final StatementType IS = StatementType.INCOME_STATEMENT;
    private static final StatementType BS = StatementType.BALANCE_SHEET;

    private final ConsistencyChecker checker = new ConsistencyChecker(new PeriodAligner());

    @Test
    @DisplayName("Should score identical structure, periods and names as fully compatible")
    void shouldScoreFullyCompatibleModels() {
        // Given
        List<StructureProbe> probes = List.of(
                probe(ModelSide.OLD, IS, "Q1 2024", "Q2 2024"),
                probe(ModelSide.NEW, IS, "1Q24", "2Q24"));
        Map<StatementType, MatchResult> matches = Map.of(IS, matches(
                MatchedPair.exact(item("Revenue"), item("Revenue")),
                MatchedPair.fuzzy(item("Total Revenue"), item("Total Revenues"), 0.93)));

        // When
        ConsistencyCheck check = checker.check(probes, matches);

        // Then
        assertThat(check.isStructureMatch()).isTrue();
        assertThat(check.isPeriodAlignmentPossible()).isTrue();
        assertThat(check.getNamingConsistency()).isEqualTo(1.0);
        assertThat(check.getCompatibilityScore()).isEqualTo(1.0, within(1e-9));
        assertThat(check.getIssues()).isEmpty();
        assertThat(check.getWarnings()).isEmpty();
        assertThat(check.getInsights()).anySatisfy(i -> assertThat(i).startsWith("High naming consistency (100.0%)"));
    }

    @Test
    @DisplayName("Should weigh naming consistency by the share of matched pairs")
    void shouldWeighNamingConsistency() {
        List<StructureProbe> probes = List.of(
                probe(ModelSide.OLD, IS, "FY2023", "FY2024"),
                probe(ModelSide.NEW, IS, "FY2023", "FY2024"));
        Map<StatementType, MatchResult> matches = Map.of(IS, matches(
                MatchedPair.exact(item("Revenue"), item("Revenue")),
                MatchedPair.oldOnly(item("Other Income")),
                MatchedPair.newOnly(item("Grants")),
                MatchedPair.newOnly(item("Royalties"))));

        ConsistencyCheck check = checker.check(probes, matches);

        assertThat(check.getNamingConsistency()).isEqualTo(0.25, within(1e-9));
        assertThat(check.getCompatibilityScore()).isEqualTo(0.4 + 0.3 * 0.25 + 0.3, within(1e-9));
        assertThat(check.getInsights()).anySatisfy(i -> assertThat(i).startsWith("Low naming consistency (25.0%)"));
    }

    @Test
    @DisplayName("Should warn when a statement shares no period between the models")
    void shouldWarnWithoutCommonPeriods() {
        List<StructureProbe> probes = List.of(
                probe(ModelSide.OLD, IS, "FY2022", "FY2023"),
                probe(ModelSide.NEW, IS, "FY2025", "FY2026"));

        ConsistencyCheck check = checker.check(probes, Map.of(IS, matches()));

        assertThat(check.isPeriodAlignmentPossible()).isFalse();
        assertThat(check.getWarnings()).singleElement().asString().contains("income_statement");
        assertThat(check.getCompatibilityScore()).isEqualTo(0.7, within(1e-9));
    }

    @Test
    @DisplayName("Should flag a statement read from only one model")
    void shouldFlagStructureMismatch() {
        // Given
        List<StructureProbe> probes = List.of(
                probe(ModelSide.OLD, IS, "FY2023", "FY2024"),
                probe(ModelSide.OLD, BS, "FY2023", "FY2024"),
                probe(ModelSide.NEW, IS, "FY2023", "FY2024"),
                StructureProbe.failed(ModelSide.NEW, BS, "BS",
                        AnalysisIssue.structural("SheetNotFound", "Sheet 'BS' not found", "BS")));

        // When
        ConsistencyCheck check = checker.check(probes, Map.of(IS, matches(MatchedPair.exact(item("Cash"), item("Cash")))));

        // Then
        assertThat(check.isStructureMatch()).isFalse();
        assertThat(check.getComparedStatements()).containsExactly(IS);
        assertThat(check.getIssues()).singleElement().asString()
                .contains("old has income_statement, balance_sheet")
                .contains("new has income_statement");
        assertThat(check.getCompatibilityScore()).isEqualTo(0.6, within(1e-9));
    }

    @Test
    @DisplayName("Should treat models with nothing comparable as incompatible")
    void shouldHandleNothingToCompare() {
        ConsistencyCheck check = checker.check(List.of(), Map.of());

        assertThat(check.isStructureMatch()).isFalse();
        assertThat(check.isPeriodAlignmentPossible()).isFalse();
        assertThat(check.getIssues()).isEmpty();
        assertThat(check.getCompatibilityScore()).isEqualTo(0.3, within(1e-9));
        assertThat(check.getWarnings()).containsExactly("No statement could be read from both models");
    }

    private static StructureProbe probe(ModelSide side, StatementType type, String... labels) {
        List<Period> periods = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            periods.add(new Period(labels[i], i + 2, "Sheet", 1, PeriodType.QUARTER));
        }
        return new StructureProbe(side, type, "Sheet", 1, periods, List.of(), List.of());
    }

    private static MatchResult matches(MatchedPair... pairs) {
        return new MatchResult(List.of(pairs), List.of());
    }

    private static LineItem item(String name) {
        return new LineItem(name, "Sheet", 2, IS, Map.of(), Map.of());
    }
}
