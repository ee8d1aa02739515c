package com.Excel.Variance.formula;

import com.Excel.Variance.util.CellAddressUtils;
import lombok.Value;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-cell reference such as {@code B7}, {@code $B$7} or {@code Sheet1!B7}.
 */
@Value
public class CellRef implements Reference {

    private static final Pattern A1 = Pattern.compile("(\\$?)([A-Za-z]{1,3})(\\$?)(\\d+)");

    String workbook;
    String sheet;
    int col;
    int row;
    boolean absoluteCol;
    boolean absoluteRow;

    public static CellRef of(String sheet, int col, int row) {
        return new CellRef(null, sheet, col, row, false, false);
    }

    /**
     * Parse an A1 address with optional '$' markers. No sheet prefix.
     */
    public static CellRef parseA1(String workbook, String sheet, String address) {
        Matcher m = A1.matcher(address);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not an A1 cell address: " + address);
        }
        int col = CellAddressUtils.columnIndex(m.group(2));
        int row = Integer.parseInt(m.group(4));
        if (!CellAddressUtils.isValid(col, row)) {
            throw new IllegalArgumentException("Cell address out of range: " + address);
        }
        return new CellRef(workbook, sheet, col, row, !m.group(1).isEmpty(), !m.group(3).isEmpty());
    }

    public String getAddress() {
        return CellAddressUtils.toAddress(col, row);
    }

    /**
     * Address as written, keeping '$' markers, without the sheet.
     */
    public String toA1() {
        return (absoluteCol ? "$" : "") + CellAddressUtils.columnLetter(col)
                + (absoluteRow ? "$" : "") + row;
    }

    /**
     * Key used by the dependency graph: sheet-qualified, without '$' markers.
     */
    public String getKey() {
        String local = CellAddressUtils.qualify(sheet, getAddress());
        return workbook != null ? "[" + workbook + "]" + local : local;
    }

    @Override
    public List<CellRef> expand(int limit) {
        return limit > 0 ? List.of(this) : List.of();
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public CellRef qualify(String defaultSheet) {
        if (sheet != null || defaultSheet == null) {
            return this;
        }
        return new CellRef(workbook, defaultSheet, col, row, absoluteCol, absoluteRow);
    }

    @Override
    public String toString() {
        String local = sheet != null ? CellAddressUtils.qualify(sheet, toA1()) : toA1();
        return workbook != null ? "[" + workbook + "]" + local : local;
    }
}
