package com.Excel.Variance.graph;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.exception.GraphTimeoutException;
import com.Excel.Variance.formula.CellRef;
import com.Excel.Variance.formula.FormulaParser;
import com.Excel.Variance.model.Workbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.Excel.Variance.WorkbookFixtures.sheet;
import static com.Excel.Variance.WorkbookFixtures.workbook;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DependencyGraphBuilder Tests")
class DependencyGraphBuilderTest {

    private VarianceProperties properties;
    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new VarianceProperties();
        builder = new DependencyGraphBuilder(new FormulaParser(), properties);
    }

    @Test
    @DisplayName("Should expand formulas down to constant leaves")
    void shouldExpandToLeaves() {
        // Given
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .value(2, 2, 10.0)
                .formula(3, 2, "B5*2", 20.0)
                .formula(4, 2, "B2+B3", 30.0)
                .value(5, 2, 10.0)
                .build());

        // When
        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 2, 4));

        // Then
        assertThat(graph.size()).isEqualTo(4);
        assertThat(graph.getFindings()).isEmpty();
        FormulaNode root = graph.getRoot();
        assertThat(root.getKind()).isEqualTo(NodeKind.FORMULA);
        assertThat(root.getResolvedValue()).isEqualTo(30.0);
        assertThat(root.getOperands()).extracting(FormulaNode::getKey).containsExactly("IS!B2", "IS!B3");
        assertThat(graph.getNode("IS!B3").getOperands()).extracting(FormulaNode::getKey).containsExactly("IS!B5");
        assertThat(graph.getLeaves()).extracting(FormulaNode::getKey).containsExactlyInAnyOrder("IS!B2", "IS!B5");
    }

    @Test
    @DisplayName("Should share one node for a cell read by several formulas")
    void shouldReuseSharedOperands() {
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "B1+C1", 15.0)
                .formula(1, 2, "D1", 5.0)
                .formula(1, 3, "D1*2", 10.0)
                .value(1, 4, 5.0)
                .build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.size()).isEqualTo(4);
        assertThat(graph.getNode("IS!B1").getOperands().get(0))
                .isSameAs(graph.getNode("IS!C1").getOperands().get(0));
        assertThat(graph.hasCircularReference()).isFalse();
    }

    @Test
    @DisplayName("Should record a circular reference with its path and terminate")
    void shouldDetectCycle() {
        // Given
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "A2+1", 0.0)
                .formula(2, 1, "A1*2", 0.0)
                .build());

        // When
        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        // Then
        assertThat(graph.hasCircularReference()).isTrue();
        assertThat(graph.getFindings()).anySatisfy(f -> {
            assertThat(f.getType()).isEqualTo(GraphFinding.Type.CIRCULAR_REFERENCE);
            assertThat(f.getMessage()).contains("IS!A1 -> IS!A2 -> IS!A1");
        });
        assertThat(graph.getNode("IS!A1").isCircular()).isTrue();
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should detect a cell that reads itself")
    void shouldDetectSelfReference() {
        Workbook wb = workbook("model.xlsx", sheet("IS").formula(1, 1, "A1+1", 0.0).build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.hasCircularReference()).isTrue();
    }

    @Test
    @DisplayName("Should stop expanding at the depth bound and mark the cell truncated")
    void shouldTruncateAtMaxDepth() {
        // Given
        properties.setMaxGraphDepth(2);
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "A2", 5.0)
                .formula(2, 1, "A3", 5.0)
                .formula(3, 1, "A4", 5.0)
                .value(4, 1, 5.0)
                .build());

        // When
        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        // Then
        assertThat(graph.isTruncated()).isTrue();
        assertThat(graph.getNode("IS!A3").getKind()).isEqualTo(NodeKind.TRUNCATED);
        assertThat(graph.getNode("IS!A3").isLeaf()).isTrue();
        assertThat(graph.getNode("IS!A4")).isNull();
    }

    @Test
    @DisplayName("Should expand a cell cut off at the depth bound once a shorter path reaches it")
    void shouldExpandTruncatedCellReachedOnShorterPath() {
        // Given
        properties.setMaxGraphDepth(2);
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "B1+C1", 10.0)
                .formula(1, 2, "C1", 5.0)
                .formula(1, 3, "D1", 5.0)
                .value(1, 4, 5.0)
                .build());

        // When
        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        // Then
        FormulaNode c1 = graph.getNode("IS!C1");
        assertThat(c1.getKind()).isEqualTo(NodeKind.FORMULA);
        assertThat(c1.getDepth()).isEqualTo(1);
        assertThat(c1.getOperands()).extracting(FormulaNode::getKey).containsExactly("IS!D1");
        assertThat(graph.getNode("IS!B1").getOperands()).containsExactly(c1);
        assertThat(graph.isTruncated()).isFalse();
        assertThat(graph.getFindings()).isEmpty();
    }

    @Test
    @DisplayName("Should pass a shorter depth down to cells below an already expanded node")
    void shouldPropagateShorterDepthToOperands() {
        // Given
        properties.setMaxGraphDepth(3);
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "B1+C1", 10.0)
                .formula(1, 2, "C1", 5.0)
                .formula(1, 3, "D1", 5.0)
                .formula(1, 4, "E1", 5.0)
                .value(1, 5, 5.0)
                .build());

        // When
        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        // Then
        assertThat(graph.getNode("IS!D1").getKind()).isEqualTo(NodeKind.FORMULA);
        assertThat(graph.getNode("IS!D1").getDepth()).isEqualTo(2);
        assertThat(graph.getNode("IS!E1").getKind()).isEqualTo(NodeKind.CONSTANT);
        assertThat(graph.hasFinding(GraphFinding.Type.DEPTH_TRUNCATED)).isFalse();
    }

    @Test
    @DisplayName("Should keep a cell truncated when every path to it is too long")
    void shouldKeepTruncationWithoutShorterPath() {
        properties.setMaxGraphDepth(2);
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "B1+B1", 10.0)
                .formula(1, 2, "C1", 5.0)
                .formula(1, 3, "D1", 5.0)
                .value(1, 4, 5.0)
                .build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.getNode("IS!C1").getKind()).isEqualTo(NodeKind.TRUNCATED);
        assertThat(graph.getFindings()).filteredOn(f -> f.getType() == GraphFinding.Type.DEPTH_TRUNCATED).hasSize(1);
    }

    @Test
    @DisplayName("Should keep external formulas as leaves with their cached value")
    void shouldStopAtExternalReferences() {
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "[Budget.xlsx]Plan!B2", 100.0)
                .build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.getRoot().isExternal()).isTrue();
        assertThat(graph.getRoot().getResolvedValue()).isEqualTo(100.0);
        assertThat(graph.hasFinding(GraphFinding.Type.EXTERNAL_REFERENCE)).isTrue();
        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep opaque formulas as leaves with the parse warning")
    void shouldStopAtOpaqueFormulas() {
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "B1+OFFSET(B1,1,0)", 7.0)
                .value(1, 2, 3.0)
                .build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.getRoot().isOpaque()).isTrue();
        assertThat(graph.getRoot().getParseWarning()).contains("OFFSET");
        assertThat(graph.getRoot().getOperands()).isEmpty();
        assertThat(graph.hasFinding(GraphFinding.Type.PARSE_WARNING)).isTrue();
    }

    @Test
    @DisplayName("Should report references to sheets that do not exist")
    void shouldReportMissingSheet() {
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "Missing!B2+B3", 0.0)
                .value(3, 2, 1.0)
                .build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.getNode("Missing!B2").getKind()).isEqualTo(NodeKind.MISSING);
        assertThat(graph.hasFinding(GraphFinding.Type.MISSING_SHEET)).isTrue();
        assertThat(graph.getRoot().getOperands()).hasSize(2);
    }

    @Test
    @DisplayName("Should cap range expansion and report it")
    void shouldTruncateLargeRanges() {
        properties.setMaxRangeCells(3);
        Workbook wb = workbook("model.xlsx", sheet("IS")
                .formula(1, 1, "SUM(B1:B10)", 0.0)
                .build());

        DependencyGraph graph = builder.build(wb, CellRef.of("IS", 1, 1));

        assertThat(graph.hasFinding(GraphFinding.Type.RANGE_TRUNCATED)).isTrue();
        assertThat(graph.getRoot().getOperands()).hasSize(3);
    }

    @Test
    @DisplayName("Should abort once the deadline has passed")
    void shouldTimeOut() {
        Workbook wb = workbook("model.xlsx", sheet("IS").formula(1, 1, "B1", 0.0).build());
        Instant past = Instant.now().minusSeconds(1);

        assertThatThrownBy(() -> builder.build(wb, CellRef.of("IS", 1, 1), past))
                .isInstanceOf(GraphTimeoutException.class)
                .hasMessageContaining("IS!A1");
    }

    @Test
    @DisplayName("Should require a sheet-qualified root")
    void shouldRejectUnqualifiedRoot() {
        Workbook wb = workbook("model.xlsx", sheet("IS").build());

        assertThatThrownBy(() -> builder.build(wb, CellRef.of(null, 1, 1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
