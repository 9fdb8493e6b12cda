package com.jreinhal.norma.golden;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.norma.synthesis.CandidateAction;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ActionValidatorTest {

    private static final String PROMPT = "Come si calcola l'imposta sostitutiva con ricavi di 50.000 euro?";

    private final ActionValidator validator = new ActionValidator();

    private static CandidateAction action(String label, String prompt) {
        return new CandidateAction("a1", label, "calculator", prompt, null);
    }

    @Nested
    @DisplayName("format rules")
    class Format {

        @Test
        void rejectsMissingFields() {
            assertThat(validator.validate(action(null, PROMPT), null).rejectionReason()).isEqualTo("missing_fields");
            assertThat(validator.validate(action("Calcola l'imposta", " "), null).valid()).isFalse();
            assertThat(validator.validate(null, null).valid()).isFalse();
        }

        @Test
        void rejectsShortLabel() {
            ValidationResult result = validator.validate(action("Calcola", PROMPT), null);

            assertThat(result.valid()).isFalse();
            assertThat(result.rejectionReason()).startsWith("label_too_short");
        }

        @Test
        void truncatesLongLabelAndAccepts() {
            ValidationResult result = validator.validate(
                    action("Calcola l'imposta sostitutiva dovuta nel regime forfettario", PROMPT), null);

            assertThat(result.valid()).isTrue();
            assertThat(result.effectiveAction().label()).isEqualTo("Calcola l'imposta sostitutiva dovuta nel").hasSize(40);
            assertThat(result.original().label()).hasSize(59);
        }

        @Test
        void rejectsShortPrompt() {
            assertThat(validator.validate(action("Calcola l'imposta", "Quanto pago?"), null).rejectionReason())
                    .startsWith("prompt_too_short");
        }

        @Test
        void normalizesIcons() {
            assertThat(validator.validate(new CandidateAction("a1", "Verifica la scadenza F24", " Calendar", PROMPT, null), null)
                    .effectiveAction().icon()).isEqualTo("calendar");
            assertThat(validator.validate(new CandidateAction("a1", "Verifica la scadenza F24", "rocket", PROMPT, null), null)
                    .effectiveAction().icon()).isEqualTo(ActionValidator.DEFAULT_ICON);
            assertThat(validator.validate(new CandidateAction("a1", "Verifica la scadenza F24", null, PROMPT, null), null)
                    .effectiveAction().icon()).isEqualTo(ActionValidator.DEFAULT_ICON);
            assertThat(validator.validate(action("Verifica la scadenza F24", PROMPT), null).modifiedAction()).isNull();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"Approfondisci", "Dettagli", "Scopri di più.", "MAGGIORI INFORMAZIONI", "Learn more"})
    void rejectsGenericLabels(String label) {
        assertThat(validator.validate(action(label, PROMPT), null).rejectionReason()).startsWith("generic_label");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Consulta un commercialista",
            "CONSULTA UN COMMERCIALISTA",
            "Chiedi al tuo consulente del lavoro",
            "Rivolgiti a un avvocato esperto",
            "Visita il sito ufficiale dell'Agenzia",
            "Monitora le novità normative",
            "Resta aggiornato sulle scadenze"})
    void rejectsForbiddenSuggestions(String label) {
        ValidationResult result = validator.validate(action(label, PROMPT), null);

        assertThat(result.valid()).isFalse();
        assertThat(result.rejectionReason()).startsWith("forbidden_pattern");
    }

    @Test
    void rejectsForbiddenSuggestionInPrompt() {
        ValidationResult result = validator.validate(action("Verifica i requisiti",
                "Per sicurezza contatta un commercialista di fiducia prima di procedere"), null);

        assertThat(result.valid()).isFalse();
    }

    @Test
    void rejectsForbiddenSuggestionBeyondTruncationPoint() {
        String label = "Ricalcola l'IVA dovuta e poi consulta un commercialista";

        ValidationResult result = validator.validate(action(label, PROMPT), null);

        assertThat(label).hasSize(55);
        assertThat(label.indexOf("commercialista")).isGreaterThan(ActionValidator.LABEL_MAX);
        assertThat(result.valid()).isFalse();
        assertThat(result.rejectionReason()).startsWith("forbidden_pattern");
    }

    @Test
    void ungroundedActionIsWarnedNotRejected() {
        ResponseContext context = new ResponseContext("Aliquota IVA?", "L'aliquota è del 22%.", "DPR 633/1972", null,
                List.of("22%"), "aliquota", List.of("aliquota", "22%", "DPR 633/1972"));

        ValidationResult grounded = validator.validate(action("Applica l'aliquota del 22%", PROMPT), context);
        ValidationResult ungrounded = validator.validate(action("Verifica la scadenza F24", PROMPT), context);

        assertThat(grounded.warnings()).isEmpty();
        assertThat(ungrounded.valid()).isTrue();
        assertThat(ungrounded.warnings()).containsExactly("no_grounding");
    }

    @Nested
    class Batch {

        @Test
        void dedupesSimilarLabelsAndScoresQuality() {
            BatchValidationResult batch = validator.validateBatch(List.of(
                    action("Calcola l'IVA al 22%", PROMPT),
                    action("Calcola IVA al 22%", PROMPT),
                    action("Verifica la scadenza del 16 marzo", PROMPT),
                    action("Approfondisci", PROMPT)), null);

            assertThat(batch.validatedActions()).extracting(CandidateAction::label)
                    .containsExactly("Calcola l'IVA al 22%", "Verifica la scadenza del 16 marzo");
            assertThat(batch.rejectedCount()).isEqualTo(2);
            assertThat(batch.qualityScore()).isEqualTo(0.5);
            assertThat(batch.rejectionLog()).anyMatch(entry -> entry.contains("duplicate"));
        }

        @Test
        void keepsDuplicatesWhenDedupeIsOff() {
            BatchValidationResult batch = validator.validateBatch(List.of(
                    action("Calcola l'IVA al 22%", PROMPT), action("Calcola IVA al 22%", PROMPT)), null, false);

            assertThat(batch.validCount()).isEqualTo(2);
        }

        @Test
        void emptyBatchHasZeroQuality() {
            assertThat(validator.validateBatch(null, null).qualityScore()).isZero();
        }
    }

    @Test
    void jaccardIgnoresStopWords() {
        assertThat(ActionValidator.jaccard("Calcola la rata", "Calcola una rata")).isEqualTo(1.0);
        assertThat(ActionValidator.jaccard("Calcola la rata", "Verifica la scadenza")).isZero();
    }
}
