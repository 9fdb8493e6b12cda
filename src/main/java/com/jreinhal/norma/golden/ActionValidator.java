package com.jreinhal.norma.golden;

import com.jreinhal.norma.constant.StopWords;
import com.jreinhal.norma.synthesis.CandidateAction;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Format, content and safety rules for follow-up actions. Rules run in a fixed order:
 * missing fields, label minimum, label truncation, prompt minimum, generic label,
 * forbidden pattern, grounding (warning only), icon normalization.
 */
@Component
public class ActionValidator {
    private static final Logger log = LoggerFactory.getLogger(ActionValidator.class);

    public static final int LABEL_MIN = 8;
    public static final int LABEL_MAX = 40;
    public static final int PROMPT_MIN = 25;
    public static final String DEFAULT_ICON = "calculator";
    public static final Set<String> ICONS = Set.of("calculator", "calendar", "document", "search", "scale", "chart",
            "list", "alert", "book", "info");

    static final String REASON_MISSING_FIELDS = "missing_fields";
    static final String REASON_LABEL_TOO_SHORT = "label_too_short";
    static final String REASON_PROMPT_TOO_SHORT = "prompt_too_short";
    static final String REASON_GENERIC_LABEL = "generic_label";
    static final String REASON_FORBIDDEN = "forbidden_pattern";
    static final String REASON_DUPLICATE = "duplicate";
    static final String WARNING_UNGROUNDED = "no_grounding";

    private static final Set<String> GENERIC_LABELS = Set.of(
            "approfondisci", "scopri di più", "scopri di piu", "maggiori informazioni", "più informazioni",
            "piu informazioni", "dettagli", "vedi dettagli", "altri dettagli", "calcola", "leggi di più", "leggi tutto",
            "clicca qui", "continua", "altro", "info", "informazioni", "approfondimento", "chiedi ancora",
            "learn more", "read more", "more info", "more information", "details", "see details", "calculate",
            "click here", "continue", "more");

    private static final List<Pattern> FORBIDDEN_PATTERNS = List.of(
            Pattern.compile("\\b(consulta|contatta|rivolgiti|rivolgersi|chiedi|senti|interpella)\\w*\\b.{0,30}\\b(commercialist|consulent|avvocat|espert|professionist|notai|caf\\b|patronat|fiscalist|tributarist)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(commercialista|consulente del lavoro|consulente fiscale|un avvocato|un esperto|un professionista|il tuo caf|un caf|patronato)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(visita|consulta|controlla|verifica)\\w*\\b.{0,30}\\b(sito|portale|pagina)\\b.{0,30}\\b(ufficial|agenzia|inps|inail|ministero|entrate|governo)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(sito ufficiale|portale ufficiale|sito dell'agenzia|sito web dell|agenziaentrate\\.gov|inps\\.it)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(monitora|monitorare|tieni d'occhio|resta aggiornat|rimani aggiornat|tieniti aggiornat|segui gli aggiornamenti|iscriviti alla newsletter|attendi (nuove|ulteriori) (indicazioni|comunicazioni))", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(monitora|controlla) (le )?(comunicazioni|novità|news)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(consult|ask|contact|see|talk to)\\w*\\b.{0,20}\\b(accountant|lawyer|attorney|professional|expert|advisor|official website)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(stay (up to date|updated|tuned)|monitor (the )?(news|updates|communications))", Pattern.CASE_INSENSITIVE));

    public ValidationResult validate(CandidateAction action, ResponseContext context) {
        if (action == null || isBlank(action.label()) || isBlank(action.prompt())) {
            return ValidationResult.rejected(action, REASON_MISSING_FIELDS);
        }
        String label = action.label().trim();
        if (label.length() < LABEL_MIN) {
            return ValidationResult.rejected(action, REASON_LABEL_TOO_SHORT + " (" + label.length() + ")");
        }
        CandidateAction modified = null;
        if (label.length() > LABEL_MAX) {
            label = label.substring(0, LABEL_MAX);
            modified = action.withLabel(label);
        }
        if (action.prompt().trim().length() < PROMPT_MIN) {
            return ValidationResult.rejected(action, REASON_PROMPT_TOO_SHORT + " (" + action.prompt().trim().length() + ")");
        }
        if (isGeneric(label)) {
            return ValidationResult.rejected(action, REASON_GENERIC_LABEL + ": " + label);
        }
        String text = action.label() + " " + action.prompt();
        for (Pattern pattern : FORBIDDEN_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return ValidationResult.rejected(action, REASON_FORBIDDEN + ": " + pattern.matcher(text).results()
                        .findFirst().map(m -> m.group().trim()).orElse(""));
            }
        }
        List<String> warnings = new ArrayList<>();
        if (context != null && !isGrounded(action, context)) {
            warnings.add(WARNING_UNGROUNDED);
        }
        String icon = action.icon() == null ? "" : action.icon().trim().toLowerCase(Locale.ROOT);
        if (!ICONS.contains(icon)) {
            modified = (modified != null ? modified : action).withIcon(DEFAULT_ICON);
        } else if (!icon.equals(action.icon())) {
            modified = (modified != null ? modified : action).withIcon(icon);
        }
        return new ValidationResult(action, true, null, modified, warnings);
    }

    public BatchValidationResult validateBatch(List<CandidateAction> actions, ResponseContext context) {
        return this.validateBatch(actions, context, true);
    }

    public BatchValidationResult validateBatch(List<CandidateAction> actions, ResponseContext context, boolean dedupe) {
        List<CandidateAction> accepted = new ArrayList<>();
        List<String> rejections = new ArrayList<>();
        List<ValidationResult> results = new ArrayList<>();
        List<CandidateAction> input = actions == null ? List.of() : actions;
        for (CandidateAction action : input) {
            ValidationResult result = this.validate(action, context);
            if (result.valid() && dedupe && isDuplicate(result.effectiveAction(), accepted)) {
                result = ValidationResult.rejected(action, REASON_DUPLICATE);
            }
            results.add(result);
            if (result.valid()) {
                accepted.add(result.effectiveAction());
            } else {
                rejections.add(describe(action) + ": " + result.rejectionReason());
            }
        }
        double quality = input.isEmpty() ? 0.0 : (double) accepted.size() / input.size();
        if (!rejections.isEmpty()) {
            log.debug("Golden loop validation: {}/{} accepted, rejections={}", accepted.size(), input.size(), rejections);
        }
        return new BatchValidationResult(accepted, input.size() - accepted.size(), rejections, quality, results);
    }

    public static boolean matchesForbiddenPattern(String text) {
        if (text == null) {
            return false;
        }
        for (Pattern pattern : FORBIDDEN_PATTERNS) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    static boolean isGeneric(String label) {
        String normalized = label.toLowerCase(Locale.ITALIAN).replaceAll("[.!?…]+$", "").trim();
        return GENERIC_LABELS.contains(normalized);
    }

    static boolean isGrounded(CandidateAction action, ResponseContext context) {
        String text = (action.label() + " " + action.prompt() + " "
                + (action.sourceBasis() == null ? "" : action.sourceBasis())).toLowerCase(Locale.ITALIAN);
        for (String term : context.groundingTerms()) {
            if (term != null && term.length() >= 2 && text.contains(term.toLowerCase(Locale.ITALIAN))) {
                return true;
            }
        }
        return action.sourceBasis() != null && !action.sourceBasis().isBlank();
    }

    static double jaccard(String a, String b) {
        Set<String> wordsA = significantWords(a);
        Set<String> wordsB = significantWords(b);
        if (wordsA.isEmpty() || wordsB.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(wordsA);
        intersection.retainAll(wordsB);
        Set<String> union = new HashSet<>(wordsA);
        union.addAll(wordsB);
        return (double) intersection.size() / union.size();
    }

    private static boolean isDuplicate(CandidateAction action, List<CandidateAction> accepted) {
        for (CandidateAction existing : accepted) {
            if (jaccard(existing.label(), action.label()) > 0.5) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> significantWords(String text) {
        Set<String> words = new HashSet<>();
        for (String word : text.toLowerCase(Locale.ITALIAN).split("[^\\p{L}\\p{N}%]+")) {
            if (!word.isEmpty() && !StopWords.ACTION_LABELS.contains(word) && !StopWords.ITALIAN.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }

    private static String describe(CandidateAction action) {
        return action == null ? "null" : "'" + action.label() + "'";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
