package com.jreinhal.norma.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValueExtractorTest {

    private static final String TEXT = "L'aliquota è del 22% e si applica oltre la soglia di 85.000 euro entro il 16/03/2025.";

    @Test
    void extractsValuesByKind() {
        assertThat(ValueExtractor.percentages(TEXT)).containsExactly("22%");
        assertThat(ValueExtractor.amounts(TEXT)).containsExactly("85.000 euro");
        assertThat(ValueExtractor.dates(TEXT)).containsExactly("16/03/2025");
    }

    @Test
    void allKeepsPercentagesFirst() {
        assertThat(ValueExtractor.all(TEXT)).containsExactly("22%", "85.000 euro", "16/03/2025");
    }

    @Test
    void normalizesEquivalentPercentages() {
        assertThat(ValueExtractor.normalize("22 %")).isEqualTo("22");
        assertThat(ValueExtractor.normalize("22,0%")).isEqualTo("22");
        assertThat(ValueExtractor.normalize("22%")).isEqualTo(ValueExtractor.normalize("22 %"));
        assertThat(ValueExtractor.normalize("5%")).isNotEqualTo(ValueExtractor.normalize("15%"));
    }

    @Test
    void classifiesValues() {
        assertThat(ValueExtractor.isPercentage("10%")).isTrue();
        assertThat(ValueExtractor.isAmount("€ 1.000")).isTrue();
        assertThat(ValueExtractor.isDate("2025-06-30")).isTrue();
        assertThat(ValueExtractor.isNumber("cinque")).isFalse();
    }

    @Test
    void handlesEmptyText() {
        assertThat(ValueExtractor.all(null)).isEmpty();
        assertThat(ValueExtractor.all("")).isEmpty();
    }
}
