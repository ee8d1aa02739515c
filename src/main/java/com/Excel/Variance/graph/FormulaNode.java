package com.Excel.Variance.graph;

import com.Excel.Variance.formula.CellRef;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One cell of a dependency graph. Operands are the distinct cells its formula reads, in formula order.
 * Nodes are filled in by {@link DependencyGraphBuilder} and not changed after the build returns.
 */
@Getter
public class FormulaNode implements Evaluable {

    private final CellRef cellRef;
    private final String expression;
    private final Double resolvedValue;
    private int depth; // shallowest depth the cell was reached at
    private final List<FormulaNode> operands = new ArrayList<>();

    private NodeKind kind;
    private boolean circular;
    private String parseWarning;

    FormulaNode(CellRef cellRef, String expression, Double resolvedValue, int depth, NodeKind kind) {
        this.cellRef = cellRef;
        this.expression = expression;
        this.resolvedValue = resolvedValue;
        this.depth = depth;
        this.kind = kind;
    }

    @Override
    public boolean isLeaf() {
        return kind != NodeKind.FORMULA;
    }

    public boolean isExternal() {
        return kind == NodeKind.EXTERNAL;
    }

    public boolean isTruncated() {
        return kind == NodeKind.TRUNCATED;
    }

    public boolean isOpaque() {
        return kind == NodeKind.OPAQUE;
    }

    public boolean hasFormula() {
        return expression != null;
    }

    public List<FormulaNode> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public String getKey() {
        return cellRef.getKey();
    }

    void addOperand(FormulaNode operand) {
        operands.add(operand);
    }

    void setDepth(int depth) {
        this.depth = depth;
    }

    void setKind(NodeKind kind) {
        this.kind = kind;
    }

    void markCircular() {
        this.circular = true;
    }

    void setParseWarning(String parseWarning) {
        this.parseWarning = parseWarning;
    }

    @Override
    public String toString() {
        return String.format("FormulaNode{%s, kind=%s, value=%s, operands=%d}",
                cellRef.getKey(), kind, resolvedValue, operands.size());
    }
}
