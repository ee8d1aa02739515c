package com.Excel.Variance.graph;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything one root cell depends on, keyed by sheet-qualified address.
 * Cycles are recorded as findings, the node map itself is always finite.
 */
@Getter
public class DependencyGraph {

    private final FormulaNode root;
    private final Map<String, FormulaNode> nodes;
    private final List<GraphFinding> findings;

    DependencyGraph(FormulaNode root, Map<String, FormulaNode> nodes, List<GraphFinding> findings) {
        this.root = root;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.findings = List.copyOf(findings);
    }

    public FormulaNode getNode(String key) {
        return nodes.get(key);
    }

    public int size() {
        return nodes.size();
    }

    public boolean hasCircularReference() {
        return hasFinding(GraphFinding.Type.CIRCULAR_REFERENCE);
    }

    public boolean isTruncated() {
        return hasFinding(GraphFinding.Type.DEPTH_TRUNCATED) || hasFinding(GraphFinding.Type.RANGE_TRUNCATED);
    }

    public boolean hasFinding(GraphFinding.Type type) {
        return findings.stream().anyMatch(f -> f.getType() == type);
    }

    /**
     * Leaves reachable from the root: constants, external reads, opaque and truncated cells.
     */
    public List<FormulaNode> getLeaves() {
        return nodes.values().stream()
                .filter(FormulaNode::isLeaf)
                .collect(Collectors.toList());
    }
}
