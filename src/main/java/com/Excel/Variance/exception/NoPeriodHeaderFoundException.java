package com.Excel.Variance.exception;

import com.Excel.Variance.dto.IssueCategory;

public class NoPeriodHeaderFoundException extends VarianceAnalysisException {

    public NoPeriodHeaderFoundException(String sheet, int scannedRows, int minimumMatches) {
        super(IssueCategory.STRUCTURAL_ERROR,
                String.format("No period header row found in sheet '%s': none of the first %d rows has %d or more period labels",
                        sheet, scannedRows, minimumMatches),
                sheet, null, null);
    }
}
