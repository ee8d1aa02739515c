package com.Excel.Variance.formula;

import com.Excel.Variance.exception.FormulaParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Excel formula text into tokens. Only as much of the grammar is understood as is needed to find
 * cell and range operands; operators and literals are recognised so they can be skipped.
 * Malformed input raises {@link FormulaParseException}.
 */
public final class FormulaTokenizer {

    private static final String CELL = "\\$?[A-Za-z]{1,3}\\$?\\d+";

    private static final Pattern CELL_OR_RANGE = Pattern.compile("(" + CELL + ")(?::(" + CELL + "))?");
    private static final Pattern COLUMN_RANGE = Pattern.compile("\\$?[A-Za-z]{1,3}:\\$?[A-Za-z]{1,3}");
    private static final Pattern ROW_RANGE = Pattern.compile("\\$?\\d+:\\$?\\d+");
    private static final Pattern NUMBER = Pattern.compile("(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\\\][A-Za-z0-9_.]*");
    private static final Pattern UNQUOTED_SHEET = Pattern.compile("([A-Za-z_][A-Za-z0-9_.]*)!");
    private static final Pattern EXTERNAL_PREFIX = Pattern.compile("\\[([^\\]]+)\\]([A-Za-z0-9_.]*)!");
    private static final Pattern ERROR_LITERAL = Pattern.compile(
            "#(NULL!|DIV/0!|VALUE!|REF!|NAME\\?|NUM!|N/A|GETTING_DATA|SPILL!|CALC!)", Pattern.CASE_INSENSITIVE);

    private static final String OPERATOR_CHARS = "+-*/^&=<>%@:";

    private final String formula;
    private final String text;
    private final int offset; // length of a stripped leading '='
    private final List<FormulaToken> tokens = new ArrayList<>();
    private int pos;

    private FormulaTokenizer(String formula) {
        this.formula = formula;
        this.offset = formula.startsWith("=") ? 1 : 0;
        this.text = formula.substring(offset);
    }

    public static List<FormulaToken> tokenize(String formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula must not be null");
        }
        FormulaTokenizer tokenizer = new FormulaTokenizer(formula);
        tokenizer.run();
        return tokenizer.tokens;
    }

    private void run() {
        int parenDepth = 0;
        int braceDepth = 0;

        while (pos < text.length()) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"') {
                readString();
            } else if (c == '#') {
                readError();
            } else if (c == '\'') {
                readQuotedSheetReference();
            } else if (c == '[') {
                readExternalReference();
            } else if (c == '(') {
                parenDepth++;
                add(FormulaToken.Type.OPEN_PAREN, "(");
            } else if (c == ')') {
                if (--parenDepth < 0) {
                    throw error("Unbalanced ')'");
                }
                add(FormulaToken.Type.CLOSE_PAREN, ")");
            } else if (c == '{') {
                braceDepth++;
                add(FormulaToken.Type.OPEN_BRACE, "{");
            } else if (c == '}') {
                if (--braceDepth < 0) {
                    throw error("Unbalanced '}'");
                }
                add(FormulaToken.Type.CLOSE_BRACE, "}");
            } else if (c == ',' || c == ';') {
                add(FormulaToken.Type.SEPARATOR, String.valueOf(c));
            } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
                readOperator();
            } else if (Character.isLetterOrDigit(c) || c == '$' || c == '_' || c == '.' || c == '\\') {
                readWord();
            } else {
                throw error("Unexpected character '" + c + "'");
            }
        }

        if (parenDepth != 0) {
            throw error("Unbalanced parentheses");
        }
        if (braceDepth != 0) {
            throw error("Unbalanced braces");
        }
    }

    private void add(FormulaToken.Type type, String tokenText) {
        tokens.add(FormulaToken.of(type, tokenText, pos + offset));
        pos += tokenText.length();
    }

    private void readString() {
        int start = pos;
        int i = pos + 1;
        while (i < text.length()) {
            if (text.charAt(i) == '"') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                tokens.add(FormulaToken.of(FormulaToken.Type.STRING, text.substring(start, i + 1), start + offset));
                pos = i + 1;
                return;
            }
            i++;
        }
        throw error("Unterminated string literal");
    }

    private void readError() {
        Matcher m = ERROR_LITERAL.matcher(text).region(pos, text.length());
        if (!m.lookingAt()) {
            throw error("Unknown error literal");
        }
        tokens.add(FormulaToken.of(FormulaToken.Type.ERROR, m.group().toUpperCase(Locale.ROOT), pos + offset));
        pos = m.end();
    }

    private void readOperator() {
        int start = pos;
        if (pos + 1 < text.length()) {
            String two = text.substring(pos, pos + 2);
            if (two.equals("<>") || two.equals("<=") || two.equals(">=")) {
                add(FormulaToken.Type.OPERATOR, two);
                return;
            }
        }
        tokens.add(FormulaToken.of(FormulaToken.Type.OPERATOR, String.valueOf(text.charAt(start)), start + offset));
        pos++;
    }

    /**
     * 'Sheet Name'!A1 or 'C:\dir\[Book.xlsx]Sheet Name'!A1:B2
     */
    private void readQuotedSheetReference() {
        int start = pos;
        StringBuilder content = new StringBuilder();
        int i = pos + 1;
        boolean closed = false;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\'') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    content.append('\'');
                    i += 2;
                    continue;
                }
                closed = true;
                i++;
                break;
            }
            content.append(c);
            i++;
        }
        if (!closed) {
            throw error("Unterminated quoted sheet name");
        }
        if (i >= text.length() || text.charAt(i) != '!') {
            throw error("Expected '!' after quoted sheet name");
        }

        String workbook = null;
        String sheet = content.toString();
        int open = sheet.indexOf('[');
        int close = sheet.indexOf(']');
        if (open >= 0 && close > open) {
            workbook = sheet.substring(open + 1, close);
            sheet = sheet.substring(close + 1);
        }
        pos = i + 1;
        readReferenceAfterPrefix(start, workbook, sheet.isEmpty() ? null : sheet);
    }

    /**
     * [Book.xlsx]Sheet1!A1 or [1]Sheet1!A1
     */
    private void readExternalReference() {
        int start = pos;
        Matcher m = EXTERNAL_PREFIX.matcher(text).region(pos, text.length());
        if (!m.lookingAt()) {
            throw error("Unsupported bracketed reference");
        }
        String sheet = m.group(2);
        pos = m.end();
        readReferenceAfterPrefix(start, m.group(1), sheet.isEmpty() ? null : sheet);
    }

    private void readWord() {
        int start = pos;

        Matcher sheetPrefix = UNQUOTED_SHEET.matcher(text).region(pos, text.length());
        if (sheetPrefix.lookingAt()) {
            pos = sheetPrefix.end();
            readReferenceAfterPrefix(start, null, sheetPrefix.group(1));
            return;
        }

        if (tryLineReference(start)) {
            return;
        }

        if (tryCellOrRange(start, null, null)) {
            return;
        }

        char c = text.charAt(pos);
        if (Character.isDigit(c) || c == '.') {
            Matcher number = NUMBER.matcher(text).region(pos, text.length());
            if (number.lookingAt()) {
                tokens.add(FormulaToken.of(FormulaToken.Type.NUMBER, number.group(), start + offset));
                pos = number.end();
                return;
            }
            throw error("Malformed number");
        }

        Matcher identifier = IDENTIFIER.matcher(text).region(pos, text.length());
        if (identifier.lookingAt()) {
            String word = identifier.group();
            pos = identifier.end();
            int next = skipWhitespace(pos);
            if (next < text.length() && text.charAt(next) == '(') {
                tokens.add(FormulaToken.of(FormulaToken.Type.FUNCTION, word.toUpperCase(Locale.ROOT), start + offset));
            } else if (word.equalsIgnoreCase("TRUE") || word.equalsIgnoreCase("FALSE")) {
                tokens.add(FormulaToken.of(FormulaToken.Type.BOOLEAN, word.toUpperCase(Locale.ROOT), start + offset));
            } else {
                tokens.add(FormulaToken.of(FormulaToken.Type.NAME, word, start + offset));
            }
            return;
        }

        throw error("Unexpected character '" + c + "'");
    }

    private void readReferenceAfterPrefix(int start, String workbook, String sheet) {
        if (pos >= text.length()) {
            throw error("Expected cell reference after sheet prefix");
        }
        if (tryLineReference(start)) {
            return;
        }
        if (tryCellOrRange(start, workbook, sheet)) {
            return;
        }
        if (text.charAt(pos) == '#') {
            readError();
            return;
        }
        Matcher identifier = IDENTIFIER.matcher(text).region(pos, text.length());
        if (identifier.lookingAt()) {
            // defined name scoped to a sheet or another workbook
            tokens.add(FormulaToken.of(FormulaToken.Type.NAME, text.substring(start, identifier.end()), start + offset));
            pos = identifier.end();
            return;
        }
        throw error("Expected cell reference after sheet prefix");
    }

    private boolean tryCellOrRange(int start, String workbook, String sheet) {
        Matcher m = CELL_OR_RANGE.matcher(text).region(pos, text.length());
        if (!m.lookingAt() || continuesIdentifier(m.end())) {
            return false;
        }
        Reference reference;
        try {
            CellRef first = CellRef.parseA1(workbook, sheet, m.group(1));
            reference = m.group(2) == null
                    ? first
                    : new RangeRef(first, CellRef.parseA1(workbook, sheet, m.group(2)));
        } catch (IllegalArgumentException e) {
            // letters beyond XFD, so it is a name rather than a cell
            return false;
        }
        tokens.add(FormulaToken.reference(text.substring(start, m.end()), start + offset, reference));
        pos = m.end();
        return true;
    }

    private boolean tryLineReference(int start) {
        for (Pattern pattern : new Pattern[]{COLUMN_RANGE, ROW_RANGE}) {
            Matcher m = pattern.matcher(text).region(pos, text.length());
            if (m.lookingAt() && !continuesIdentifier(m.end())) {
                tokens.add(FormulaToken.of(FormulaToken.Type.LINE_REFERENCE, text.substring(start, m.end()), start + offset));
                pos = m.end();
                return true;
            }
        }
        return false;
    }

    private boolean continuesIdentifier(int index) {
        if (index >= text.length()) {
            return false;
        }
        char c = text.charAt(index);
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '(' || c == '!';
    }

    private int skipWhitespace(int index) {
        int i = index;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private FormulaParseException error(String message) {
        return new FormulaParseException(message, formula, pos + offset);
    }
}
