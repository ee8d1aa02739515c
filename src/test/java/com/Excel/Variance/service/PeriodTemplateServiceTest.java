package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.dto.PeriodTemplate;
import com.Excel.Variance.model.PeriodType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PeriodTemplateService Tests")
class PeriodTemplateServiceTest {

    private final PeriodTemplateService service = new PeriodTemplateService();

    @Test
    @DisplayName("Should compile placeholders into a case-insensitive full-match pattern")
    void shouldCompilePlaceholders() {
        // When
        PeriodPattern pattern = service.compile(new PeriodTemplate("Quarter", "Q{Q} {YYYY}", PeriodType.QUARTER));

        // Then
        assertThat(pattern.match("Q1 2024")).isNotNull();
        assertThat(pattern.match("q3   2025")).isNotNull();
        assertThat(pattern.match("Q5 2024")).isNull();
        assertThat(pattern.match("Q1 2024 Budget")).isNull();
        Matcher m = pattern.match("Q2 2031");
        assertThat(pattern.year(m)).isEqualTo(2031);
        assertThat(pattern.getType()).isEqualTo(PeriodType.QUARTER);
    }

    @Test
    @DisplayName("Should support optional groups")
    void shouldCompileOptionalGroup() {
        PeriodPattern pattern = service.compile(new PeriodTemplate(null, "FY{YY}[E]", PeriodType.YEAR));

        assertThat(pattern.match("FY24")).isNotNull();
        assertThat(pattern.match("FY24E")).isNotNull();
        assertThat(pattern.getName()).isEqualTo("FY{YY}[E]");
    }

    @Test
    @DisplayName("Should default the period type to OTHER")
    void shouldDefaultType() {
        PeriodPattern pattern = service.compile(new PeriodTemplate("Week", "W{WW}-{YYYY}", null));

        assertThat(pattern.getType()).isEqualTo(PeriodType.OTHER);
        assertThat(pattern.match("W07-2024")).isNotNull();
    }

    @Test
    @DisplayName("Should reject invalid templates")
    void shouldRejectInvalidTemplates() {
        assertThatThrownBy(() -> service.compile(new PeriodTemplate("x", "  ", null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.compile(new PeriodTemplate("x", "Q{X}", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown placeholder");
        assertThatThrownBy(() -> service.compile(new PeriodTemplate("x", "FY{YYYY}E]", null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.compile(new PeriodTemplate("x", "FY{YYYY", null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should derive templates from labels")
    void shouldDeriveTemplates() {
        assertThat(service.toTemplate("Q1 2024")).isEqualTo("Q{Q} {YYYY}");
        assertThat(service.toTemplate("1Q24")).isEqualTo("{Q}Q{YY}");
        assertThat(service.toTemplate("FY2025E")).isEqualTo("FY{YYYY}[E]");
        assertThat(service.toTemplate("Mar-24")).isEqualTo("{MMM}-{YY}");
    }

    @Test
    @DisplayName("A derived template should match other labels of the same shape")
    void derivedTemplateMatchesSiblings() {
        String template = service.toTemplate("1Q24");

        PeriodPattern pattern = service.compile(new PeriodTemplate("derived", template, PeriodType.QUARTER));

        assertThat(pattern.match("3Q25")).isNotNull();
    }

    @Test
    @DisplayName("Should rank suggestions by how many labels share the shape")
    void shouldSuggestTemplatesByFrequency() {
        // Given
        PeriodDetector detector = new PeriodDetector(new VarianceProperties());
        List<String> labels = List.of("FY2025E", "Q1 2024", "Q2 2024", "Q3 2024", "{bad}");

        // When
        List<PeriodTemplate> suggestions = service.suggestTemplates(labels, detector);

        // Then
        assertThat(suggestions).hasSize(2);
        assertThat(suggestions.get(0).getPattern()).isEqualTo("Q{Q} {YYYY}");
        assertThat(suggestions.get(0).getName()).isEqualTo("Suggested 1");
        assertThat(suggestions.get(0).getType()).isEqualTo(PeriodType.QUARTER);
        assertThat(suggestions.get(1).getPattern()).isEqualTo("FY{YYYY}[E]");
        assertThat(suggestions.get(1).getType()).isEqualTo(PeriodType.YEAR);
    }
}
