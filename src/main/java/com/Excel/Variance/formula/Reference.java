package com.Excel.Variance.formula;

import java.util.List;

/**
 * A cell or range operand found in a formula.
 */
public interface Reference {

    /**
     * Sheet named in the formula, or null when the reference is local to the formula's sheet.
     */
    String getSheet();

    /**
     * External workbook named in the formula ("Book2.xlsx" or an index like "1"), or null.
     */
    String getWorkbook();

    default boolean isExternal() {
        return getWorkbook() != null;
    }

    default boolean isCrossSheet() {
        return getSheet() != null;
    }

    /**
     * Constituent cells in row-major order, at most {@code limit} of them.
     */
    List<CellRef> expand(int limit);

    int size();

    /**
     * Same reference with the sheet filled in when the formula left it implicit.
     */
    Reference qualify(String defaultSheet);
}
