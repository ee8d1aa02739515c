package com.Excel.Variance.formula;

import lombok.Value;

@Value
public class FormulaToken {

    public enum Type {
        NUMBER,
        STRING,
        BOOLEAN,
        ERROR,
        REFERENCE,
        /** Whole column ({@code A:A}) or whole row ({@code 3:3}) reference */
        LINE_REFERENCE,
        FUNCTION,
        NAME,
        OPERATOR,
        OPEN_PAREN,
        CLOSE_PAREN,
        SEPARATOR,
        OPEN_BRACE,
        CLOSE_BRACE
    }

    Type type;
    String text;
    int position;
    Reference reference; // set for REFERENCE tokens only

    public static FormulaToken of(Type type, String text, int position) {
        return new FormulaToken(type, text, position, null);
    }

    public static FormulaToken reference(String text, int position, Reference reference) {
        return new FormulaToken(Type.REFERENCE, text, position, reference);
    }
}
