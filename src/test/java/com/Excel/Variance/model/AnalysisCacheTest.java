package com.Excel.Variance.model;

import com.Excel.Variance.dto.DrillDownOutcome;
import com.Excel.Variance.dto.StructureProbe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnalysisCache Tests")
class AnalysisCacheTest {

    private final AnalysisCache cache = new AnalysisCache("session-1");

    @Test
    @DisplayName("Should compute a probe once and serve it from the cache afterwards")
    void shouldCacheProbes() {
        AtomicInteger loads = new AtomicInteger();

        StructureProbe first = cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, selection -> probe(loads));
        StructureProbe second = cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, selection -> probe(loads));

        assertThat(second).isSameAs(first);
        assertThat(loads).hasValue(1);
    }

    @Test
    @DisplayName("Should keep sides and statement types apart")
    void shouldKeyBySideAndType() {
        AtomicInteger loads = new AtomicInteger();

        cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, selection -> probe(loads));
        cache.getProbe(ModelSide.NEW, StatementType.INCOME_STATEMENT, selection -> probe(loads));
        cache.getProbe(ModelSide.OLD, StatementType.CASH_FLOW, selection -> probe(loads));

        assertThat(loads).hasValue(3);
    }

    @Test
    @DisplayName("Should recompute everything after invalidation")
    void shouldInvalidate() {
        // Given
        AtomicInteger loads = new AtomicInteger();
        DrillDownKey key = new DrillDownKey("session-1", StatementType.INCOME_STATEMENT, "Revenue", "Q1 2024");
        cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, selection -> probe(loads));
        cache.putDrillDown(key, new DrillDownOutcome(), cache.getGeneration());

        // When
        cache.invalidate();

        // Then
        assertThat(cache.getDrillDown(key)).isNull();
        assertThat(cache.drillDownCount()).isZero();
        cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, selection -> probe(loads));
        assertThat(loads).hasValue(2);
    }

    @Test
    @DisplayName("Should not store a drill-down computed before an invalidation")
    void shouldIgnoreStaleDrillDown() {
        DrillDownKey key = new DrillDownKey("session-1", StatementType.INCOME_STATEMENT, "Revenue", "Q1 2024");
        long generation = cache.getGeneration();

        cache.invalidate();
        cache.putDrillDown(key, new DrillDownOutcome(), generation);

        assertThat(cache.getDrillDown(key)).isNull();
    }

    @Test
    @DisplayName("Should hand loaders the selection current when the lookup starts")
    void shouldLoadWithCurrentSelection() {
        SheetSelection selection = selection("P&L");
        cache.select(selection);

        List<SheetSelection> seen = new ArrayList<>();
        cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, current -> {
            seen.add(current);
            return probeOf(current);
        });

        assertThat(seen).containsExactly(selection);
        assertThat(cache.getSelection()).isSameAs(selection);
    }

    @Test
    @DisplayName("Should not keep a structure result whose selection was replaced while it was computed")
    void shouldDropStructureComputedAcrossReselection() {
        // Given
        cache.select(selection("A"));

        // When
        StructureProbe inFlight = cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, current -> {
            cache.select(selection("B"));
            return probeOf(current);
        });
        StructureProbe afterwards = cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, this::probeOf);

        // Then
        assertThat(inFlight.getSheetName()).isEqualTo("A");
        assertThat(afterwards.getSheetName()).isEqualTo("B");
        assertThat(cache.getProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, this::probeOf)).isSameAs(afterwards);
    }

    @Test
    @DisplayName("Should not keep a match whose inputs changed selection while it was computed")
    void shouldDropMatchComputedAcrossReselection() {
        cache.select(selection("A"));
        AtomicInteger loads = new AtomicInteger();

        cache.getMatch(StatementType.INCOME_STATEMENT, () -> {
            loads.incrementAndGet();
            cache.select(selection("B"));
            return new MatchResult(List.of(), List.of());
        });
        cache.getMatch(StatementType.INCOME_STATEMENT, () -> {
            loads.incrementAndGet();
            return new MatchResult(List.of(), List.of());
        });

        assertThat(loads).hasValue(2);
    }

    private StructureProbe probeOf(SheetSelection selection) {
        String sheet = selection.sheetFor(ModelSide.OLD, StatementType.INCOME_STATEMENT);
        return new StructureProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, sheet, 1, List.of(), List.of(), List.of());
    }

    private static SheetSelection selection(String sheet) {
        return new SheetSelection(Map.of(StatementType.INCOME_STATEMENT, sheet), null, null);
    }

    private static StructureProbe probe(AtomicInteger loads) {
        loads.incrementAndGet();
        return new StructureProbe(ModelSide.OLD, StatementType.INCOME_STATEMENT, "IS", 1, List.of(), List.of(), List.of());
    }
}
