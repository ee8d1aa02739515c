package com.Excel.Variance.service;

import com.Excel.Variance.dto.DrillDownPreview;
import com.Excel.Variance.formula.FormulaParseResult;
import com.Excel.Variance.formula.FormulaParser;
import com.Excel.Variance.model.LineItem;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class DrillDownPreviewService {

    private static final int SIMPLE_MAX_REFERENCES = 3;
    private static final int MODERATE_MAX_REFERENCES = 10;

    private final FormulaParser formulaParser;

    public DrillDownPreviewService(FormulaParser formulaParser) {
        this.formulaParser = formulaParser;
    }

    /**
     * Preview for the formula in {@code period}, or for the first period holding a formula when period is null.
     */
    public DrillDownPreview preview(LineItem item, String period) {
        String label = period;
        String formula = null;
        if (label != null) {
            formula = item.getFormula(label);
        } else {
            for (Map.Entry<String, String> entry : item.getFormulas().entrySet()) {
                label = entry.getKey();
                formula = entry.getValue();
                break;
            }
        }

        if (formula == null) {
            return new DrillDownPreview(item.getName(), label, null, false, 0, false, false, null, null, null);
        }

        FormulaParseResult parsed = formulaParser.parse(formula, item.getSheet());
        int referenceCount = parsed.getReferencedCellCount();
        boolean crossSheet = parsed.hasCrossSheetReferences(item.getSheet());

        DrillDownPreview.Complexity complexity;
        if (parsed.isOpaque() || parsed.isExternal()
                || referenceCount > MODERATE_MAX_REFERENCES || parsed.getFunctions().size() > 3) {
            complexity = DrillDownPreview.Complexity.COMPLEX;
        } else if (referenceCount <= SIMPLE_MAX_REFERENCES && parsed.getFunctions().size() <= 1 && !crossSheet) {
            complexity = DrillDownPreview.Complexity.SIMPLE;
        } else {
            complexity = DrillDownPreview.Complexity.MODERATE;
        }

        return new DrillDownPreview(item.getName(), label, formula,
                !parsed.isOpaque() && !parsed.isExternal() && referenceCount > 0,
                referenceCount, crossSheet, parsed.isExternal(), parsed.getMainFunction(), complexity,
                parsed.getParseWarning());
    }
}
