package com.Excel.Variance.graph;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.exception.GraphTimeoutException;
import com.Excel.Variance.formula.CellRef;
import com.Excel.Variance.formula.FormulaParseResult;
import com.Excel.Variance.formula.FormulaParser;
import com.Excel.Variance.model.Cell;
import com.Excel.Variance.model.Sheet;
import com.Excel.Variance.model.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Expands a cell's formula depth-first into the graph of everything it transitively reads.
 * Each build keeps its own traversal state, so one builder can serve concurrent requests.
 */
@Component
public class DependencyGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final FormulaParser formulaParser;
    private final VarianceProperties properties;

    public DependencyGraphBuilder(FormulaParser formulaParser, VarianceProperties properties) {
        this.formulaParser = formulaParser;
        this.properties = properties;
    }

    public DependencyGraph build(Workbook workbook, CellRef root) {
        return build(workbook, root, null);
    }

    /**
     * Build the graph rooted at {@code root}, a sheet-qualified cell of {@code workbook}.
     *
     * @param deadline wall-clock limit checked at every cell; null for no limit
     * @throws GraphTimeoutException when the deadline passes or the thread is interrupted
     */
    public DependencyGraph build(Workbook workbook, CellRef root, Instant deadline) {
        if (root.getSheet() == null) {
            throw new IllegalArgumentException("Root cell must name its sheet: " + root);
        }
        logger.debug("Building dependency graph for {} in workbook '{}'", root.getKey(), workbook.getName());

        Walk walk = new Walk(workbook, root, deadline);
        FormulaNode rootNode = walk.visit(root, 0);

        DependencyGraph graph = new DependencyGraph(rootNode, walk.nodes, walk.findings);
        logger.debug("Dependency graph for {}: {} nodes, {} findings", root.getKey(), graph.size(), walk.findings.size());
        return graph;
    }

    private class Walk {
        private final Workbook workbook;
        private final CellRef root;
        private final Instant deadline;
        private final Map<String, FormulaNode> nodes = new LinkedHashMap<>();
        private final List<GraphFinding> findings = new ArrayList<>();
        private final Set<String> visiting = new HashSet<>();
        private final Deque<String> path = new ArrayDeque<>();

        Walk(Workbook workbook, CellRef root, Instant deadline) {
            this.workbook = workbook;
            this.root = root;
            this.deadline = deadline;
        }

        FormulaNode visit(CellRef ref, int depth) {
            String key = ref.getKey();

            if (visiting.contains(key)) {
                FormulaNode node = nodes.get(key);
                node.markCircular();
                String cycle = String.join(" -> ", reversedPath()) + " -> " + key;
                logger.warn("Circular reference detected: {}", cycle);
                addFinding(GraphFinding.Type.CIRCULAR_REFERENCE, ref, "Circular reference: " + cycle);
                return node;
            }

            FormulaNode existing = nodes.get(key);
            if (existing != null) {
                if (depth < existing.getDepth()) {
                    revisit(existing, depth);
                }
                return existing;
            }

            checkDeadline();

            Optional<Sheet> sheet = workbook.findSheet(ref.getSheet());
            if (sheet.isEmpty()) {
                FormulaNode node = register(new FormulaNode(ref, null, null, depth, NodeKind.MISSING));
                addFinding(GraphFinding.Type.MISSING_SHEET, ref,
                        "Referenced sheet '" + ref.getSheet() + "' does not exist in workbook '" + workbook.getName() + "'");
                return node;
            }

            Cell cell = sheet.get().getCell(ref.getRow(), ref.getCol());
            if (cell == null || !cell.hasFormula()) {
                Double value = cell != null ? cell.getNumericValue() : null;
                return register(new FormulaNode(ref, null, value, depth, NodeKind.CONSTANT));
            }

            FormulaNode node = register(new FormulaNode(ref, cell.getFormula(), cell.getNumericValue(), depth, NodeKind.FORMULA));
            expand(node, depth);
            return node;
        }

        /**
         * A node already in the graph was reached on a shorter path. Its depth drops, a node cut off at the
         * bound is expanded after all, and an expanded node passes the new depth on to its operands.
         */
        private void revisit(FormulaNode node, int depth) {
            checkDeadline();
            node.setDepth(depth);

            if (node.isTruncated()) {
                CellRef ref = node.getCellRef();
                findings.removeIf(f -> f.getType() == GraphFinding.Type.DEPTH_TRUNCATED && isAt(f, ref));
                node.setKind(NodeKind.FORMULA);
                expand(node, depth);
            } else if (node.getKind() == NodeKind.FORMULA) {
                String key = node.getKey();
                visiting.add(key);
                path.push(key);
                try {
                    for (FormulaNode operand : node.getOperands()) {
                        visit(operand.getCellRef(), depth + 1);
                    }
                } finally {
                    path.pop();
                    visiting.remove(key);
                }
            }
        }

        private void expand(FormulaNode node, int depth) {
            CellRef ref = node.getCellRef();
            String key = node.getKey();

            if (depth >= properties.getMaxGraphDepth()) {
                node.setKind(NodeKind.TRUNCATED);
                addFinding(GraphFinding.Type.DEPTH_TRUNCATED, ref,
                        "Expansion stopped at depth " + depth + ", cell treated as a leaf");
                return;
            }

            FormulaParseResult parsed = formulaParser.parse(node.getExpression(), ref.getSheet());
            if (parsed.isExternal()) {
                node.setKind(NodeKind.EXTERNAL);
                addFinding(GraphFinding.Type.EXTERNAL_REFERENCE, ref,
                        "Formula reads another workbook, cached value used");
                return;
            }
            if (parsed.isOpaque()) {
                node.setKind(NodeKind.OPAQUE);
                node.setParseWarning(parsed.getParseWarning());
                addFinding(GraphFinding.Type.PARSE_WARNING, ref, parsed.getParseWarning());
                return;
            }

            int maxRangeCells = properties.getMaxRangeCells();
            if (parsed.getReferencedCellCount() > maxRangeCells) {
                addFinding(GraphFinding.Type.RANGE_TRUNCATED, ref,
                        "Formula references " + parsed.getReferencedCellCount() + " cells, only the first "
                                + maxRangeCells + " are expanded");
            }

            visiting.add(key);
            path.push(key);
            try {
                for (CellRef operand : parsed.distinctCells(ref.getSheet(), maxRangeCells)) {
                    node.addOperand(visit(operand, depth + 1));
                }
            } finally {
                path.pop();
                visiting.remove(key);
            }
        }

        private FormulaNode register(FormulaNode node) {
            nodes.put(node.getKey(), node);
            return node;
        }

        private void addFinding(GraphFinding.Type type, CellRef ref, String message) {
            // a cell reached again on a shorter path reports each problem once
            boolean known = findings.stream().anyMatch(f -> f.getType() == type && isAt(f, ref));
            if (!known) {
                findings.add(new GraphFinding(type, ref.getSheet(), ref.getRow(), ref.getCol(), message));
            }
        }

        private boolean isAt(GraphFinding finding, CellRef ref) {
            return finding.getRow() == ref.getRow() && finding.getCol() == ref.getCol()
                    && Objects.equals(finding.getSheet(), ref.getSheet());
        }

        private List<String> reversedPath() {
            List<String> result = new ArrayList<>(path);
            Collections.reverse(result);
            return result;
        }

        private void checkDeadline() {
            if (Thread.currentThread().isInterrupted()
                    || (deadline != null && Instant.now().isAfter(deadline))) {
                throw new GraphTimeoutException(root.getSheet(), root.getAddress(), nodes.size());
            }
        }
    }
}
