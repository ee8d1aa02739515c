package com.Excel.Variance.util;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Helpers for interpreting raw cell values.
 */
public final class CellValueUtils {

    private static final Pattern STRICT_NUMBER =
            Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    private CellValueUtils() {
    }

    /**
     * Numeric value of a raw cell value, or null when it holds no number.
     * Strings count only when the whole trimmed text is a plain decimal number.
     */
    public static Double toNumber(Object rawValue) {
        if (rawValue instanceof Number) {
            double d = ((Number) rawValue).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (rawValue instanceof String) {
            String text = ((String) rawValue).trim();
            if (STRICT_NUMBER.matcher(text).matches()) {
                return Double.parseDouble(text);
            }
        }
        return null;
    }

    public static boolean isNumeric(Object rawValue) {
        return toNumber(rawValue) != null;
    }

    /**
     * A label is meaningful when it is text with at least one letter or digit,
     * so separators like "----" or "( )" are rejected.
     */
    public static boolean isMeaningfulLabel(Object rawValue) {
        if (!(rawValue instanceof String)) {
            return false;
        }
        String text = (String) rawValue;
        if (StringUtils.isBlank(text)) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetterOrDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public static boolean isBlank(Object rawValue) {
        return rawValue == null || (rawValue instanceof String && StringUtils.isBlank((String) rawValue));
    }

    /**
     * Display text of a header cell: strings verbatim, integral numbers without the ".0".
     */
    public static String toHeaderText(Object rawValue) {
        if (rawValue == null) {
            return null;
        }
        if (rawValue instanceof String) {
            return (String) rawValue;
        }
        if (rawValue instanceof Number) {
            double d = ((Number) rawValue).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        return String.valueOf(rawValue);
    }
}
