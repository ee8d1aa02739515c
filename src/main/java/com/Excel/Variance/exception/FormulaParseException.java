package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

/**
 * Malformed formula text. Position is the 0-based character offset in the formula.
 */
public class FormulaParseException extends VarianceAnalysisException {

    private final int position;

    public FormulaParseException(String message, String formula, int position) {
        super(IssueCategory.FORMULA_ERROR,
                String.format("%s at position %d in formula '%s'", message, position, formula),
                null, null, null);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
