package com.jreinhal.norma.reasoning;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RiskAnalyzerTest {

    private final RiskAnalyzer analyzer = new RiskAnalyzer();

    private static Hypothesis hypothesis(String conclusion, RiskLevel declared) {
        return new Hypothesis("H1", "percorso", conclusion, 0.5, List.of(), 0, 0, declared, List.of(), null);
    }

    @Test
    void detectsCriminalExposureEvenWhenModelSaysLow() {
        Hypothesis analyzed = analyzer.analyze(hypothesis("L'utilizzo di fatture false integra il reato di dichiarazione fraudolenta", RiskLevel.LOW));

        assertThat(analyzed.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
        assertThat(analyzed.riskFactors()).contains("fatture false", "reato");
    }

    @Test
    void detectsHighSanctions() {
        Hypothesis analyzed = analyzer.analyze(hypothesis("In caso di accertamento la sanzione va dal 90% al 180% dell'imposta", null));

        assertThat(analyzed.riskLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void detectsOrdinaryPenalties() {
        assertThat(analyzer.analyze(hypothesis("Si può rimediare con il ravvedimento operoso", RiskLevel.LOW)).riskLevel())
                .isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void neverLowersDeclaredLevel() {
        assertThat(analyzer.analyze(hypothesis("Nessuna conseguenza", RiskLevel.HIGH)).riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(analyzer.analyze(hypothesis("Nessuna conseguenza", null)).riskLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void parsesItalianLabels() {
        assertThat(RiskLevel.fromLabel("Alto")).isEqualTo(RiskLevel.HIGH);
        assertThat(RiskLevel.fromLabel("critico")).isEqualTo(RiskLevel.CRITICAL);
        assertThat(RiskLevel.fromLabel("?")).isNull();
    }
}
