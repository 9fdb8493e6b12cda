package com.jreinhal.norma.rag.expansion;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.norma.model.ConversationTurn;
import java.util.List;
import org.junit.jupiter.api.Test;

class AmbiguityDetectorTest {

    private final AmbiguityDetector detector = new AmbiguityDetector();

    private static final List<ConversationTurn> FORFETTARIO_HISTORY = List.of(
            new ConversationTurn("user", "Come funziona il regime forfettario per i professionisti?"),
            new ConversationTurn("assistant", "Il regime forfettario prevede un'imposta sostitutiva del 15%..."));

    @Test
    void followUpAfterHistoryIsMultiVariant() {
        AmbiguityAssessment assessment = detector.assess("E per l'IVA?", FORFETTARIO_HISTORY);

        assertThat(assessment.strategy()).isEqualTo(AmbiguityStrategy.MULTI_VARIANT);
        assertThat(assessment.variantCount()).isGreaterThanOrEqualTo(2);
        assertThat(assessment.indicators()).contains(AmbiguityDetector.SHORT_QUERY, AmbiguityDetector.FOLLOWUP_PATTERN);
        assertThat(assessment.score()).isGreaterThanOrEqualTo(0.5);
    }

    @Test
    void vaguePronounQuestionGetsThreeVariants() {
        AmbiguityAssessment assessment = detector.assess("E questo come funziona?", FORFETTARIO_HISTORY);

        assertThat(assessment.isAmbiguous()).isTrue();
        assertThat(assessment.variantCount()).isEqualTo(3);
        assertThat(assessment.indicators()).contains(AmbiguityDetector.PRONOUN_AMBIGUITY, AmbiguityDetector.MISSING_DOMAIN_TERMS);
    }

    @Test
    void specificQuestionIsStandard() {
        AmbiguityAssessment assessment = detector.assess(
                "Qual è l'aliquota IVA applicabile alle prestazioni sanitarie rese da una società?", List.of());

        assertThat(assessment.strategy()).isEqualTo(AmbiguityStrategy.STANDARD);
        assertThat(assessment.indicators()).isEmpty();
        assertThat(assessment.score()).isEqualTo(0.0);
    }

    @Test
    void shortDomainQuestionWithHistoryIsConversational() {
        AmbiguityAssessment assessment = detector.assess("Aliquota IVA ridotta?", FORFETTARIO_HISTORY);

        assertThat(assessment.strategy()).isEqualTo(AmbiguityStrategy.CONVERSATIONAL);
        assertThat(assessment.variantCount()).isEqualTo(1);
    }

    @Test
    void blankQueryIsStandard() {
        assertThat(detector.assess("  ", null).strategy()).isEqualTo(AmbiguityStrategy.STANDARD);
    }
}
