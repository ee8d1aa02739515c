package com.Excel.Variance.dto;

import com.Excel.Variance.model.PeriodType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * User supplied period label pattern, e.g. {@code "FY{YY} Q{Q}"}.
 * Placeholders: {YYYY} {YY} {Q} {M} {MM} {MMM} {WW}; text in [brackets] is optional; anything else is literal.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeriodTemplate {
    private String name;
    private String pattern;
    private PeriodType type;
}
