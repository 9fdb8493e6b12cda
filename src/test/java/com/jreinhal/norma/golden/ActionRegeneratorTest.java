package com.jreinhal.norma.golden;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.norma.exception.ModelUnavailableException;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.synthesis.CandidateAction;
import com.jreinhal.norma.support.TestDocuments;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ActionRegeneratorTest {

    private ModelOrchestrator orchestrator;
    private ActionRegenerator regenerator;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ModelOrchestrator.class);
        regenerator = new ActionRegenerator(orchestrator, new ActionValidator(), new GoldenLoopProperties());
    }

    private static ResponseContext context() {
        return new ResponseContext("Qual è l'aliquota IVA ordinaria?", "L'aliquota IVA ordinaria è del 22% [1].",
                "DPR 633/1972", "Art. 16: l'aliquota è stabilita nella misura del 22%.", List.of("22%", "16/03/2025"),
                "aliquota", List.of("aliquota", "22%", "DPR 633/1972"));
    }

    @Test
    void parsesRegeneratedActions() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), contains("'Approfondisci': generic_label"),
                any(ModelCallOptions.class)))
                .thenReturn(TestDocuments.reply("[{\"label\": \"Applica il 22% a una fattura\", \"icon\": \"calculator\", "
                        + "\"prompt\": \"Come applico l'aliquota del 22% a una fattura da 1.000 euro?\"}, {\"label\": \"x\"}]"));

        List<CandidateAction> actions = regenerator.attemptRegeneration(context(),
                List.of("'Approfondisci': generic_label: approfondisci"), 1);

        assertThat(actions).hasSize(2);
        assertThat(actions.get(0).id()).isEqualTo("r1-1");
        assertThat(actions.get(1).id()).isEqualTo("r1-2");
    }

    @Test
    void unavailableModelYieldsNoActions() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenThrow(new ModelUnavailableException(ModelTier.BASIC, "down", null));

        assertThat(regenerator.attemptRegeneration(context(), List.of(), 2)).isEmpty();
    }

    @Test
    void safeFallbackUsesValuesTopicAndSource() {
        List<CandidateAction> actions = regenerator.generateSafeFallback(context());

        assertThat(actions).extracting(CandidateAction::label).containsExactly(
                "Applica l'aliquota del 22%", "Verifica la scadenza del 16/03/2025", "Dettagli su aliquota",
                "Analizza DPR 633/1972");
        assertThat(actions).allSatisfy(action -> {
            assertThat(action.label().length()).isBetween(ActionValidator.LABEL_MIN, ActionValidator.LABEL_MAX);
            assertThat(ActionValidator.matchesForbiddenPattern(action.label() + " " + action.prompt())).isFalse();
        });
    }

    @Test
    void safeFallbackWithoutGroundingStillReturnsAnAction() {
        ResponseContext empty = new ResponseContext("Ciao", "", null, null, List.of(), null, List.of());

        assertThat(regenerator.generateSafeFallback(empty)).containsExactly(ActionRegenerator.LAST_RESORT);
    }

    @Test
    void fitsLabelsAtWordBoundary() {
        String label = ActionRegenerator.fitLabel("Verifica l'importo di 85.000 euro nel regime forfettario");

        assertThat(label).isEqualTo("Verifica l'importo di 85.000 euro nel");
        assertThat(ActionRegenerator.fitLabel("  Calcola il 22%  ")).isEqualTo("Calcola il 22%");
    }

    @Test
    void removesDoubleImperative() {
        assertThat(ActionRegenerator.fixDoubleVerb("Verifica calcola il 22%")).isEqualTo("Verifica il 22%");
        assertThat(ActionRegenerator.fixDoubleVerb("Calcola l'IVA dovuta")).isEqualTo("Calcola l'IVA dovuta");
    }
}
