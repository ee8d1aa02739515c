package com.Excel.Variance.formula;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Operands of one formula in order of appearance.
 * {@code opaque} means the input set could not be fully determined and the cell must be treated as a leaf;
 * {@code parseWarning} then says why.
 */
@Value
public class FormulaParseResult {
    String formula;
    List<Reference> references;
    List<String> functions;
    boolean external;
    boolean opaque;
    boolean syntaxError;
    String parseWarning;

    public static FormulaParseResult unparseable(String formula, String warning) {
        return new FormulaParseResult(formula, List.of(), List.of(), false, true, true, warning);
    }

    /**
     * First function called, e.g. "SUM" for {@code =SUM(B2:B5)*2}.
     */
    public String getMainFunction() {
        return functions.isEmpty() ? null : functions.get(0);
    }

    /**
     * True when some operand lives on a sheet other than {@code hostSheet}.
     */
    public boolean hasCrossSheetReferences(String hostSheet) {
        return references.stream()
                .anyMatch(r -> r.getSheet() != null && !r.getSheet().equals(hostSheet));
    }

    /**
     * Distinct cells referenced, ranges expanded in place, first occurrence wins.
     */
    public List<CellRef> distinctCells(String hostSheet, int limit) {
        Set<String> seen = new LinkedHashSet<>();
        List<CellRef> cells = new ArrayList<>();
        for (Reference reference : references) {
            for (CellRef cell : reference.qualify(hostSheet).expand(limit - cells.size())) {
                if (seen.add(cell.getKey())) {
                    cells.add(cell);
                }
            }
            if (cells.size() >= limit) {
                break;
            }
        }
        return Collections.unmodifiableList(cells);
    }

    public int getReferencedCellCount() {
        long total = 0;
        for (Reference reference : references) {
            total += reference.size();
        }
        return total > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) total;
    }
}
