package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

import java.util.List;

public class SheetNotFoundException extends VarianceAnalysisException {

    public SheetNotFoundException(String workbook, String sheet, List<String> available) {
        super(IssueCategory.STRUCTURAL_ERROR,
                String.format("Sheet '%s' not found in workbook '%s'. Available sheets: %s", sheet, workbook, available),
                sheet, null, null);
    }

    public SheetNotFoundException(String message) {
        super(IssueCategory.STRUCTURAL_ERROR, message, null, null, null);
    }
}
