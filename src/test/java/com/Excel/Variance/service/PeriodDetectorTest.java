package com.Excel.Variance.service;

import com.Excel.Variance.config.VarianceProperties;
import com.Excel.Variance.dto.PeriodTemplate;
import com.Excel.Variance.exception.NoPeriodHeaderFoundException;
import com.Excel.Variance.model.Period;
import com.Excel.Variance.model.PeriodHeader;
import com.Excel.Variance.model.PeriodType;
import com.Excel.Variance.model.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.Excel.Variance.WorkbookFixtures.sheet;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PeriodDetector Tests")
class PeriodDetectorTest {

    private PeriodDetector detector;

    @BeforeEach
    void setUp() {
        detector = new PeriodDetector(new VarianceProperties());
    }

    @Test
    @DisplayName("Should return periods in column order with their verbatim labels")
    void shouldDetectScatteredPeriodColumns() {
        // Given
        Sheet s = sheet("IS")
                .value(1, 1, "Acme Corp - Income Statement")
                .value(2, 1, "USD thousands")
                .value(3, 1, "Line Item")
                .value(3, 3, "Q1 2024")
                .value(3, 7, "Q2 2024")
                .value(3, 9, "Q3 2024")
                .value(3, 12, "Q4 2024E")
                .build();

        // When
        PeriodHeader header = detector.detect(s);

        // Then
        assertThat(header.getHeaderRow()).isEqualTo(3);
        assertThat(header.getPeriods()).extracting(Period::getColumnIndex).containsExactly(3, 7, 9, 12);
        assertThat(header.getLabels()).containsExactly("Q1 2024", "Q2 2024", "Q3 2024", "Q4 2024E");
        assertThat(header.getPeriods()).extracting(Period::getPeriodType).containsOnly(PeriodType.QUARTER);
    }

    @Test
    @DisplayName("Should pick the row with the most period labels")
    void shouldPickRowWithMostPeriods() {
        Sheet s = sheet("IS")
                .row(1, null, 2022.0, 2023.0, 2024.0)
                .row(2, "Line Item", "Q1 2024", "Q2 2024", "Q3 2024", "Q4 2024")
                .build();

        assertThat(detector.detect(s).getHeaderRow()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should prefer the earliest row on ties")
    void shouldPreferEarliestRowOnTie() {
        Sheet s = sheet("IS")
                .row(1, null, "FY2023", "FY2024", "FY2025")
                .row(2, null, "Q1 2024", "Q2 2024", "Q3 2024")
                .build();

        assertThat(detector.detect(s).getHeaderRow()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count numeric year cells only inside the year range")
    void shouldReadNumericYears() {
        Sheet years = sheet("IS").row(1, "Line Item", 2022.0, 2023.0, 2024.0).build();
        Sheet amounts = sheet("IS").row(1, "Line Item", 150.0, 2023.5, 3000.0).build();

        assertThat(detector.detect(years).getLabels()).containsExactly("2022", "2023", "2024");
        assertThatThrownBy(() -> detector.detect(amounts)).isInstanceOf(NoPeriodHeaderFoundException.class);
    }

    @Test
    @DisplayName("Should never read the label column as a period")
    void shouldSkipLabelColumn() {
        Sheet s = sheet("IS").row(1, "FY2024", "FY2025", "FY2026").build();

        assertThatThrownBy(() -> detector.detect(s)).isInstanceOf(NoPeriodHeaderFoundException.class);
    }

    @Test
    @DisplayName("Should fail with a structural error when no header row qualifies")
    void shouldFailWithoutHeader() {
        // Given
        Sheet s = sheet("Notes")
                .row(1, "Assumptions")
                .row(2, "Growth", 0.05, 0.06)
                .build();

        // When / Then
        assertThatThrownBy(() -> detector.detect(s))
                .isInstanceOf(NoPeriodHeaderFoundException.class)
                .hasMessageContaining("Notes");
    }

    @Test
    @DisplayName("Should only scan the configured number of rows")
    void shouldLimitScanToHeaderRows() {
        VarianceProperties properties = new VarianceProperties();
        properties.setHeaderScanRows(2);
        PeriodDetector shallow = new PeriodDetector(properties);
        Sheet s = sheet("IS").row(3, "Line Item", "Q1 2024", "Q2 2024", "Q3 2024").build();

        assertThatThrownBy(() -> shallow.detect(s)).isInstanceOf(NoPeriodHeaderFoundException.class);
    }

    @Test
    @DisplayName("Should recognise custom labels through compiled templates")
    void shouldExtendDetectionWithTemplates() {
        // Given
        Sheet s = sheet("IS").row(1, "Line Item", "P01-2024", "P02-2024", "P03-2024").build();
        List<PeriodPattern> extra = new PeriodTemplateService()
                .compileAll(List.of(new PeriodTemplate("Fiscal period", "P{MM}-{YYYY}", PeriodType.MONTH)));

        // When / Then
        assertThatThrownBy(() -> detector.detect(s)).isInstanceOf(NoPeriodHeaderFoundException.class);
        PeriodHeader header = detector.detect(s, extra);
        assertThat(header.getLabels()).containsExactly("P01-2024", "P02-2024", "P03-2024");
        assertThat(header.getPeriods()).extracting(Period::getPeriodType).containsOnly(PeriodType.MONTH);
    }

    @Test
    @DisplayName("Should classify common period label shapes")
    void shouldClassifyLabels() {
        assertThat(detector.classify("Q1 2024")).contains(PeriodType.QUARTER);
        assertThat(detector.classify("1Q24")).contains(PeriodType.QUARTER);
        assertThat(detector.classify("FY24 Q3")).contains(PeriodType.QUARTER);
        assertThat(detector.classify("H1 2024")).contains(PeriodType.HALF_YEAR);
        assertThat(detector.classify("FY2025E")).contains(PeriodType.YEAR);
        assertThat(detector.classify("2024A")).contains(PeriodType.YEAR);
        assertThat(detector.classify("Mar-24")).contains(PeriodType.MONTH);
        assertThat(detector.classify("2024-03")).contains(PeriodType.MONTH);
        assertThat(detector.classify("2024-03-31")).contains(PeriodType.DATE);
    }

    @Test
    @DisplayName("Should reject labels that are not periods")
    void shouldRejectNonPeriods() {
        assertThat(detector.classify("Revenue")).isEmpty();
        assertThat(detector.classify("Q5 2024")).isEmpty();
        assertThat(detector.classify("1850")).isEmpty();
        assertThat(detector.classify("  ")).isEmpty();
    }
}
