package com.Excel.Variance.formula;

import com.Excel.Variance.exception.FormulaParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts the operand references of a formula. Functions are recognised only so their arguments can be
 * collected; nothing is evaluated. Anything outside the supported subset produces an opaque result with a
 * warning instead of an exception.
 */
@Component
public class FormulaParser {

    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    // Functions whose inputs are exactly their argument references
    private static final Set<String> KNOWN_FUNCTIONS = Set.of(
            // aggregates and arithmetic
            "SUM", "SUMIF", "SUMIFS", "SUMPRODUCT", "SUMSQ", "PRODUCT",
            "AVERAGE", "AVERAGEA", "AVERAGEIF", "AVERAGEIFS", "MEDIAN",
            "MIN", "MAX", "MINIFS", "MAXIFS", "MINA", "MAXA",
            "COUNT", "COUNTA", "COUNTIF", "COUNTIFS", "COUNTBLANK",
            "ROUND", "ROUNDUP", "ROUNDDOWN", "MROUND", "CEILING", "FLOOR", "INT", "TRUNC",
            "ABS", "SIGN", "MOD", "POWER", "SQRT", "EXP", "LN", "LOG", "LOG10",
            // logical
            "IF", "IFS", "IFERROR", "IFNA", "AND", "OR", "NOT", "XOR", "SWITCH", "CHOOSE", "TRUE", "FALSE",
            // lookup
            "VLOOKUP", "HLOOKUP", "XLOOKUP", "LOOKUP", "INDEX", "MATCH", "XMATCH",
            // financial
            "NPV", "XNPV", "IRR", "XIRR", "PMT", "PV", "FV", "RATE", "NPER", "IPMT", "PPMT",
            // statistics
            "STDEV", "STDEV.S", "STDEV.P", "VAR", "VAR.S", "VAR.P",
            // text
            "CONCATENATE", "CONCAT", "TEXT", "LEFT", "RIGHT", "MID", "LEN", "VALUE", "TRIM", "UPPER", "LOWER",
            // dates
            "DATE", "YEAR", "MONTH", "DAY", "EOMONTH", "EDATE", "DAYS", "TODAY", "NOW",
            // information
            "ISBLANK", "ISNUMBER", "ISERROR", "ISNA", "ISTEXT", "N"
    );

    // Functions that build references at runtime, so the input set is unknown
    private static final Set<String> DYNAMIC_REFERENCE_FUNCTIONS = Set.of("INDIRECT", "OFFSET");

    public FormulaParseResult parse(String formula) {
        return parse(formula, null);
    }

    /**
     * Parse a formula found on {@code hostSheet}; sheet-less references are qualified with it.
     */
    public FormulaParseResult parse(String formula, String hostSheet) {
        if (formula == null || formula.isBlank()) {
            return new FormulaParseResult(formula, List.of(), List.of(), false, false, false, null);
        }

        List<FormulaToken> tokens;
        try {
            tokens = FormulaTokenizer.tokenize(formula);
        } catch (FormulaParseException e) {
            logger.warn("Could not parse formula on sheet '{}': {}", hostSheet, e.getMessage());
            return FormulaParseResult.unparseable(formula, e.getMessage());
        }

        List<Reference> references = new ArrayList<>();
        Set<String> functions = new LinkedHashSet<>();
        Set<String> unsupported = new LinkedHashSet<>();
        boolean external = false;

        for (FormulaToken token : tokens) {
            switch (token.getType()) {
                case REFERENCE:
                    Reference reference = token.getReference().qualify(hostSheet);
                    external |= reference.isExternal();
                    references.add(reference);
                    break;
                case FUNCTION:
                    String name = normalizeFunctionName(token.getText());
                    functions.add(name);
                    if (DYNAMIC_REFERENCE_FUNCTIONS.contains(name)) {
                        unsupported.add(name + " builds its references at runtime");
                    } else if (!KNOWN_FUNCTIONS.contains(name)) {
                        unsupported.add("unsupported function " + name);
                    }
                    break;
                case NAME:
                    unsupported.add("named reference " + token.getText());
                    break;
                case LINE_REFERENCE:
                    unsupported.add("whole row/column reference " + token.getText());
                    break;
                case ERROR:
                    if ("#REF!".equals(token.getText())) {
                        unsupported.add("broken reference #REF!");
                    }
                    break;
                case OPERATOR:
                    if (":".equals(token.getText())) {
                        unsupported.add("computed range operator ':'");
                    }
                    break;
                default:
                    break;
            }
        }

        String warning = unsupported.isEmpty() ? null : String.join("; ", unsupported);
        if (warning != null) {
            logger.debug("Formula '{}' treated as opaque: {}", formula, warning);
        }

        return new FormulaParseResult(formula, List.copyOf(references), List.copyOf(functions),
                external, warning != null, false, warning);
    }

    static String normalizeFunctionName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        // newer functions are stored with a prefix in the file format
        for (String prefix : new String[]{"_XLFN._XLWS.", "_XLFN.", "_XLWS."}) {
            if (upper.startsWith(prefix)) {
                return upper.substring(prefix.length());
            }
        }
        return upper;
    }
}
