package com.Excel.Variance.formula;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangular range such as {@code Sheet1!$A$1:$B$5}. Both corners share the sheet and workbook of {@code start}.
 */
@Value
public class RangeRef implements Reference {
    CellRef start;
    CellRef end;

    @Override
    public String getSheet() {
        return start.getSheet();
    }

    @Override
    public String getWorkbook() {
        return start.getWorkbook();
    }

    public int getFirstRow() {
        return Math.min(start.getRow(), end.getRow());
    }

    public int getLastRow() {
        return Math.max(start.getRow(), end.getRow());
    }

    public int getFirstCol() {
        return Math.min(start.getCol(), end.getCol());
    }

    public int getLastCol() {
        return Math.max(start.getCol(), end.getCol());
    }

    @Override
    public int size() {
        long cells = (long) (getLastRow() - getFirstRow() + 1) * (getLastCol() - getFirstCol() + 1);
        return cells > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) cells;
    }

    @Override
    public List<CellRef> expand(int limit) {
        List<CellRef> cells = new ArrayList<>();
        for (int row = getFirstRow(); row <= getLastRow(); row++) {
            for (int col = getFirstCol(); col <= getLastCol(); col++) {
                if (cells.size() >= limit) {
                    return cells;
                }
                cells.add(new CellRef(getWorkbook(), getSheet(), col, row, false, false));
            }
        }
        return cells;
    }

    @Override
    public RangeRef qualify(String defaultSheet) {
        if (getSheet() != null || defaultSheet == null) {
            return this;
        }
        return new RangeRef(start.qualify(defaultSheet), end.qualify(defaultSheet));
    }

    @Override
    public String toString() {
        return start.toString() + ":" + end.toA1();
    }
}
