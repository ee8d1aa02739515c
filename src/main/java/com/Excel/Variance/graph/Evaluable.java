package com.Excel.Variance.graph;

/**
 * Uniform view of a dependency graph node, whether its formula was fully parsed or kept opaque.
 */
public interface Evaluable {

    /**
     * Numeric value of the cell as stored in the file, or null when it holds no number.
     */
    Double getResolvedValue();

    boolean isLeaf();
}
