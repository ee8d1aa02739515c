package com.Excel.Variance.util;

/**
 * Utility class for converting between Excel column letters, indexes and A1 addresses.
 * Rows and columns are 1-based, the way Excel numbers them.
 */
public final class CellAddressUtils {

    public static final int MAX_COLUMN = 16384; // XFD
    public static final int MAX_ROW = 1048576;

    private CellAddressUtils() {
    }

    /**
     * Convert column index to letters, 1 -> A, 27 -> AA
     */
    public static String columnLetter(int columnIndex) {
        if (columnIndex < 1) {
            throw new IllegalArgumentException("Column index must be >= 1: " + columnIndex);
        }
        StringBuilder result = new StringBuilder();
        int n = columnIndex;
        while (n > 0) {
            n--;
            result.insert(0, (char) ('A' + n % 26));
            n /= 26;
        }
        return result.toString();
    }

    /**
     * Convert column letters to index, A -> 1, AA -> 27. Case-insensitive.
     */
    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Column letters must not be empty");
        }
        int result = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            result = result * 26 + (c - 'A' + 1);
        }
        return result;
    }

    public static String toAddress(int columnIndex, int row) {
        return columnLetter(columnIndex) + row;
    }

    /**
     * Sheet-qualified address, quoting the sheet name when it is not a plain identifier.
     */
    public static String qualify(String sheet, String address) {
        if (sheet == null) {
            return address;
        }
        if (sheet.matches("[A-Za-z_][A-Za-z0-9_.]*")) {
            return sheet + "!" + address;
        }
        return "'" + sheet.replace("'", "''") + "'!" + address;
    }

    public static boolean isValid(int columnIndex, int row) {
        return columnIndex >= 1 && columnIndex <= MAX_COLUMN && row >= 1 && row <= MAX_ROW;
    }
}
