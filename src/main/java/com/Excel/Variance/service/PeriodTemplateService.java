package com.Excel.Variance.service;

import com.Excel.Variance.dto.PeriodTemplate;
import com.Excel.Variance.model.PeriodType;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles user period templates into {@link PeriodPattern}s and derives templates from detected labels.
 */
@Service
public class PeriodTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(PeriodTemplateService.class);

    static final String MONTH_NAMES = "jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec";

    private static final Map<String, String> PLACEHOLDERS = new LinkedHashMap<>();

    static {
        PLACEHOLDERS.put("YYYY", "\\d{4}");
        PLACEHOLDERS.put("YY", "\\d{2}");
        PLACEHOLDERS.put("Q", "[1-4]");
        PLACEHOLDERS.put("M", "(?:1[0-2]|0?[1-9])");
        PLACEHOLDERS.put("MM", "(?:0[1-9]|1[0-2])");
        PLACEHOLDERS.put("MMM", "(?:" + MONTH_NAMES + ")[a-z]*\\.?");
        PLACEHOLDERS.put("WW", "(?:0?[1-9]|[1-4]\\d|5[0-3])");
    }

    // Order matters: month names before digits, four digits before two
    private static final Pattern LABEL_PARTS = Pattern.compile(
            "(?<mmm>(?i:" + MONTH_NAMES + ")[a-z]*)"
                    + "|(?<yyyy>\\d{4})"
                    + "|(?<q>(?<=[Qq])[1-4](?!\\d)|[1-4](?=[Qq]))"
                    + "|(?<yy>\\d{2})"
                    + "|(?<m>\\d)");

    /**
     * Compile a template to an anchored case-insensitive pattern.
     *
     * @throws IllegalArgumentException for an empty template, an unknown placeholder or unbalanced brackets
     */
    public PeriodPattern compile(PeriodTemplate template) {
        if (template == null || StringUtils.isBlank(template.getPattern())) {
            throw new IllegalArgumentException("Period template pattern must not be empty");
        }
        String source = template.getPattern().trim();
        StringBuilder regex = new StringBuilder();
        boolean yearNamed = false;
        boolean inOptional = false;

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '{') {
                int close = source.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed placeholder in template '" + source + "'");
                }
                String placeholder = source.substring(i + 1, close).toUpperCase(Locale.ROOT);
                String expression = PLACEHOLDERS.get(placeholder);
                if (expression == null) {
                    throw new IllegalArgumentException("Unknown placeholder {" + placeholder + "} in template '" + source + "'");
                }
                if (placeholder.equals("YYYY") && !yearNamed) {
                    regex.append("(?<year>").append(expression).append(')');
                    yearNamed = true;
                } else {
                    regex.append(expression);
                }
                i = close + 1;
            } else if (c == '[') {
                if (inOptional) {
                    throw new IllegalArgumentException("Nested optional group in template '" + source + "'");
                }
                regex.append("(?:");
                inOptional = true;
                i++;
            } else if (c == ']') {
                if (!inOptional) {
                    throw new IllegalArgumentException("Unbalanced ']' in template '" + source + "'");
                }
                regex.append(")?");
                inOptional = false;
                i++;
            } else if (Character.isWhitespace(c)) {
                while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
                    i++;
                }
                regex.append("\\s+");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        if (inOptional) {
            throw new IllegalArgumentException("Unclosed optional group in template '" + source + "'");
        }

        PeriodType type = template.getType() != null ? template.getType() : PeriodType.OTHER;
        String name = StringUtils.defaultIfBlank(template.getName(), source);
        logger.debug("Compiled period template '{}' to {}", source, regex);
        return PeriodPattern.of(name, regex.toString(), type);
    }

    public List<PeriodPattern> compileAll(List<PeriodTemplate> templates) {
        List<PeriodPattern> patterns = new ArrayList<>();
        if (templates != null) {
            for (PeriodTemplate template : templates) {
                patterns.add(compile(template));
            }
        }
        return patterns;
    }

    /**
     * Guess templates that would match the given labels, most frequent shape first.
     * Labels containing template syntax characters are skipped.
     */
    public List<PeriodTemplate> suggestTemplates(List<String> labels, PeriodDetector detector) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, PeriodType> types = new LinkedHashMap<>();

        for (String label : labels) {
            if (StringUtils.isBlank(label) || StringUtils.containsAny(label, "[]{}")) {
                continue;
            }
            String template = toTemplate(label.trim());
            counts.merge(template, 1, Integer::sum);
            types.putIfAbsent(template, detector.classify(label).orElse(PeriodType.OTHER));
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        // stable sort keeps first-seen order among equal counts
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        List<PeriodTemplate> suggestions = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : ranked) {
            suggestions.add(new PeriodTemplate("Suggested " + (suggestions.size() + 1), entry.getKey(), types.get(entry.getKey())));
        }
        return suggestions;
    }

    String toTemplate(String label) {
        StringBuilder template = new StringBuilder();
        Matcher m = LABEL_PARTS.matcher(label);
        int last = 0;
        while (m.find()) {
            template.append(label, last, m.start());
            if (m.group("mmm") != null) {
                template.append("{MMM}");
            } else if (m.group("yyyy") != null) {
                template.append("{YYYY}");
            } else if (m.group("q") != null) {
                template.append("{Q}");
            } else if (m.group("yy") != null) {
                template.append("{YY}");
            } else {
                template.append("{M}");
            }
            last = m.end();
        }
        template.append(label.substring(last));

        String result = template.toString();
        // trailing estimate marker, e.g. 2025E
        if (result.endsWith("}E") || result.endsWith("}e")) {
            result = result.substring(0, result.length() - 1) + "[E]";
        }
        return result;
    }
}
