package com.jreinhal.norma.golden;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.synthesis.CandidateAction;
import com.jreinhal.norma.util.EvidenceFormatter;
import com.jreinhal.norma.util.ModelJsonParser;
import com.jreinhal.norma.util.ValueExtractor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces replacement actions: one correction-prompt call per attempt, and a model-free
 * fallback derived from the values, topic and primary source of the answer.
 */
@Service
public class ActionRegenerator {
    private static final Logger log = LoggerFactory.getLogger(ActionRegenerator.class);

    private static final Set<String> IMPERATIVES = Set.of("calcola", "verifica", "applica", "analizza", "controlla",
            "fai", "confronta", "simula", "approfondisci", "esamina", "valuta", "riepiloga", "riassumi", "mostra");
    private static final Pattern LEADING_WORDS = Pattern.compile("^(\\p{L}+)\\s+(\\p{L}+)\\b\\s*");

    static final CandidateAction LAST_RESORT = new CandidateAction("fb-example", "Fai un esempio pratico", "calculator",
            "Fai un esempio pratico e numerico di applicazione della risposta precedente.", null);

    private static final String SYSTEM_PROMPT = """
            Generi azioni di approfondimento per professionisti italiani. Rispondi SOLO con un array JSON.
            """;

    private static final String CORRECTION_TEMPLATE = """
            Le azioni proposte in precedenza sono state scartate:
            %s

            Risposta fornita all'utente:
            %s

            Fonte principale: %s
            Estratto: %s
            Valori presenti: %s

            Genera da 2 a 4 nuove azioni ESPLICITAMENTE basate sulla fonte e sui valori indicati.
            Regole: label 8-40 caratteri con verbo all'imperativo e specifica; prompt di almeno 25 caratteri;
            mai suggerire di rivolgersi a professionisti, esperti o siti ufficiali; nessun invito a "monitorare"
            o "restare aggiornati".

            [{"id": "r1", "label": "...", "icon": "calculator|calendar|document|search|scale|chart|list|alert", "prompt": "...", "source_basis": "..."}]
            """;

    private final ModelOrchestrator modelOrchestrator;
    private final ActionValidator actionValidator;
    private final GoldenLoopProperties properties;

    public ActionRegenerator(ModelOrchestrator modelOrchestrator, ActionValidator actionValidator,
                             GoldenLoopProperties properties) {
        this.modelOrchestrator = modelOrchestrator;
        this.actionValidator = actionValidator;
        this.properties = properties;
    }

    /**
     * One correction call. Returns an empty list when the model is unavailable or the output
     * cannot be parsed.
     */
    public List<CandidateAction> attemptRegeneration(ResponseContext context, List<String> rejectionLog, int attempt) {
        String prompt = String.format(CORRECTION_TEMPLATE,
                rejectionLog == null || rejectionLog.isEmpty() ? "- nessuna azione valida" : "- " + String.join("\n- ", rejectionLog),
                EvidenceFormatter.truncate(context.answerText(), 1200),
                context.primarySource() == null ? "non disponibile" : context.primarySource(),
                context.primaryExcerpt() == null ? "non disponibile" : context.primaryExcerpt(),
                context.extractedValues().isEmpty() ? "nessuno" : String.join(", ", context.extractedValues()));
        try {
            ModelReply reply = this.modelOrchestrator.invoke(ModelTier.BASIC, SYSTEM_PROMPT, prompt,
                    ModelCallOptions.of(0.4, 600, this.properties.getRegenerationTimeoutMs()));
            List<CandidateAction> actions = new ArrayList<>();
            ModelJsonParser.parseArray(reply.text()).ifPresent(array -> {
                for (JsonNode item : array) {
                    if (item.isObject()) {
                        actions.add(new CandidateAction(ModelJsonParser.text(item, "id", "r" + attempt + "-" + (actions.size() + 1)),
                                ModelJsonParser.text(item, "label", ""), ModelJsonParser.text(item, "icon", null),
                                ModelJsonParser.text(item, "prompt", ""), ModelJsonParser.text(item, "source_basis", null)));
                    }
                }
            });
            log.info("Golden loop attempt {}: {} regenerated actions", attempt, actions.size());
            return actions;
        } catch (Exception e) {
            log.warn("Golden loop attempt {}: regeneration failed: {}", attempt, e.getMessage());
            return List.of();
        }
    }

    /**
     * Safe actions built without a model call. Always returns at least one action, and none
     * of them matches a forbidden pattern.
     */
    public List<CandidateAction> generateSafeFallback(ResponseContext context) {
        List<CandidateAction> candidates = new ArrayList<>();
        String source = context.primarySource();
        String sourceSuffix = source == null ? "" : " secondo " + source;
        int valueActions = 0;
        for (String value : context.extractedValues()) {
            if (valueActions >= 2) {
                break;
            }
            CandidateAction action = valueAction(value, sourceSuffix, candidates.size() + 1);
            if (action != null) {
                candidates.add(action);
                valueActions++;
            }
        }
        context.topic().ifPresent(topic -> candidates.add(new CandidateAction("fb-" + (candidates.size() + 1),
                fitLabel("Dettagli su " + topic), "document",
                "Quali sono gli aspetti operativi principali relativi a " + topic + sourceSuffix + "?", source)));
        if (source != null) {
            candidates.add(new CandidateAction("fb-" + (candidates.size() + 1), fitLabel("Analizza " + source), "document",
                    "Riassumi i punti di " + source + " rilevanti per la domanda: " + context.query(), source));
        }

        List<CandidateAction> safe = new ArrayList<>();
        for (CandidateAction candidate : candidates) {
            CandidateAction fixed = candidate.withLabel(fixDoubleVerb(candidate.label()));
            if (ActionValidator.matchesForbiddenPattern(fixed.label() + " " + fixed.prompt())) {
                continue;
            }
            ValidationResult result = this.actionValidator.validate(fixed, null);
            if (result.valid()) {
                safe.add(result.effectiveAction());
            }
        }
        if (safe.isEmpty()) {
            safe.add(LAST_RESORT);
        }
        log.info("Golden loop: {} safe fallback actions", safe.size());
        return safe;
    }

    private static CandidateAction valueAction(String value, String sourceSuffix, int index) {
        String id = "fb-" + index;
        if (ValueExtractor.isPercentage(value)) {
            return new CandidateAction(id, fitLabel("Applica l'aliquota del " + value), "calculator",
                    "Come si applica in un caso concreto l'aliquota del " + value + sourceSuffix + "?", null);
        }
        if (ValueExtractor.isAmount(value)) {
            return new CandidateAction(id, fitLabel("Verifica l'importo di " + value), "calculator",
                    "In quali casi si applica l'importo di " + value + sourceSuffix + " e come si calcola?", null);
        }
        if (ValueExtractor.isDate(value)) {
            return new CandidateAction(id, fitLabel("Verifica la scadenza del " + value), "calendar",
                    "Cosa succede se non si rispetta la scadenza del " + value + sourceSuffix + "?", null);
        }
        if (ValueExtractor.isNumber(value)) {
            return new CandidateAction(id, fitLabel("Fai un esempio con " + value), "calculator",
                    "Fai un esempio numerico che utilizzi il valore " + value + sourceSuffix + ".", null);
        }
        return null;
    }

    /**
     * Cuts at the last word boundary that fits the label limit.
     */
    static String fitLabel(String label) {
        String trimmed = label.trim();
        if (trimmed.length() <= ActionValidator.LABEL_MAX) {
            return trimmed;
        }
        int cut = trimmed.lastIndexOf(' ', ActionValidator.LABEL_MAX);
        String result = cut >= ActionValidator.LABEL_MIN ? trimmed.substring(0, cut) : trimmed.substring(0, ActionValidator.LABEL_MAX);
        return result.replaceAll("[\\s,;:'’-]+$", "");
    }

    /**
     * "Verifica calcola il 22%" becomes "Verifica il 22%".
     */
    static String fixDoubleVerb(String label) {
        Matcher matcher = LEADING_WORDS.matcher(label);
        if (matcher.find()) {
            String first = matcher.group(1).toLowerCase(Locale.ITALIAN);
            String second = matcher.group(2).toLowerCase(Locale.ITALIAN);
            if (IMPERATIVES.contains(first) && IMPERATIVES.contains(second)) {
                return matcher.group(1) + " " + label.substring(matcher.end());
            }
        }
        return label;
    }
}
