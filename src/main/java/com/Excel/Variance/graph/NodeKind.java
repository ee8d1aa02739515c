package com.Excel.Variance.graph;

public enum NodeKind {
    /** No formula */
    CONSTANT,
    /** Formula expanded into operand nodes */
    FORMULA,
    /** Formula that reads another workbook file */
    EXTERNAL,
    /** Formula whose inputs could not be determined */
    OPAQUE,
    /** Not expanded because the depth bound was reached */
    TRUNCATED,
    /** Cell on a sheet that does not exist in the workbook */
    MISSING
}
