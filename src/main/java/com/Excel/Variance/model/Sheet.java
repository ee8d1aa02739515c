package com.Excel.Variance.model;

import com.Excel.Variance.util.CellAddressUtils;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One worksheet. Read-only once built; only populated cells are stored.
 */
@Getter
public class Sheet {

    private final String name;

    // Key: "B:7" style, column letters then row
    private final Map<String, Cell> cells;

    private final int maxRow;
    private final int maxColumn;

    public Sheet(String name, Collection<Cell> cells) {
        this.name = name;
        Map<String, Cell> byAddress = new HashMap<>();
        int rows = 0;
        int cols = 0;
        for (Cell cell : cells) {
            byAddress.put(key(cell.getRow(), cell.getCol()), cell);
            rows = Math.max(rows, cell.getRow());
            cols = Math.max(cols, cell.getCol());
        }
        this.cells = Collections.unmodifiableMap(byAddress);
        this.maxRow = rows;
        this.maxColumn = cols;
    }

    public Cell getCell(int row, int col) {
        return cells.get(key(row, col));
    }

    public Object getRawValue(int row, int col) {
        Cell cell = getCell(row, col);
        return cell != null ? cell.getRawValue() : null;
    }

    /**
     * Cells of one row in column order.
     */
    public List<Cell> getRow(int row) {
        List<Cell> result = new ArrayList<>();
        for (int col = 1; col <= maxColumn; col++) {
            Cell cell = getCell(row, col);
            if (cell != null) {
                result.add(cell);
            }
        }
        return result;
    }

    public List<Cell> getFormulaCells() {
        List<Cell> result = new ArrayList<>();
        for (Cell cell : cells.values()) {
            if (cell.hasFormula()) {
                result.add(cell);
            }
        }
        result.sort(Comparator.comparingInt(Cell::getRow).thenComparingInt(Cell::getCol));
        return result;
    }

    private static String key(int row, int col) {
        return CellAddressUtils.columnLetter(col) + ":" + row;
    }
}
