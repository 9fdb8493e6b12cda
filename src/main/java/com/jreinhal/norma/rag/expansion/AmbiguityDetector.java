package com.jreinhal.norma.rag.expansion;

import com.jreinhal.norma.model.ConversationTurn;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores how underspecified a question is on its own. Deterministic, no model call.
 *
 * <p>Indicators and weights: short query 0.3, follow-up opener ("e per...", "what about...") 0.35,
 * bare pronoun reference 0.25, no domain term at all 0.15. Score ≥ 0.5 selects multi-variant
 * expansion (3 variants from 0.7), otherwise conversational expansion when there is history.</p>
 */
@Component
public class AmbiguityDetector {
    public static final String SHORT_QUERY = "short_query";
    public static final String FOLLOWUP_PATTERN = "followup_pattern";
    public static final String PRONOUN_AMBIGUITY = "pronoun_ambiguity";
    public static final String MISSING_DOMAIN_TERMS = "missing_domain_terms";

    static final double MULTI_VARIANT_THRESHOLD = 0.5;
    static final double THREE_VARIANTS_THRESHOLD = 0.7;
    private static final int SHORT_QUERY_WORDS = 4;

    private static final Pattern FOLLOWUP = Pattern.compile(
            "^(e\\s+(per|se|invece|nel\\s+caso|con|quanto|riguardo)|anche\\s+per|invece\\s+per|"
                    + "e\\s+l[a'’]|e\\s+il|e\\s+i|e\\s+gli|e\\s+le|what\\s+about|and\\s+(for|if|what))\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PRONOUN = Pattern.compile(
            "\\b(questo|questa|quello|quella|questi|quelli|ciò|lo\\s+stesso|la\\s+stessa|esso|essa|"
                    + "ne|lì|it|that|this|those)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DOMAIN_TERMS = Pattern.compile(
            "\\b(iva|irpef|ires|irap|imu|tasse?|impost[ae]|aliquot[ae]|detrazion[ei]|deduzion[ei]|forfettari[oa]|"
                    + "fattur[ae]|f24|dichiarazion[ei]|redditi|contribut[io]|inps|inail|tfr|ccnl|dipendent[ei]|"
                    + "societ[àa]|srl|spa|partita|codice|legge|decreto|circolare|risoluzione|interpello|sanzion[ei]|"
                    + "ravvedimento|scadenz[ae]|cedolare|successione|bollo|regime|credito|rimborso)\\b",
            Pattern.CASE_INSENSITIVE);

    public AmbiguityAssessment assess(String query, List<ConversationTurn> history) {
        if (query == null || query.isBlank()) {
            return new AmbiguityAssessment(0.0, List.of(), AmbiguityStrategy.STANDARD, 1);
        }
        String trimmed = query.trim().toLowerCase(Locale.ITALIAN);
        List<String> indicators = new ArrayList<>();
        double score = 0.0;
        int words = trimmed.split("\\s+").length;
        if (words <= SHORT_QUERY_WORDS) {
            indicators.add(SHORT_QUERY);
            score += 0.3;
        }
        if (FOLLOWUP.matcher(trimmed).find()) {
            indicators.add(FOLLOWUP_PATTERN);
            score += 0.35;
        }
        boolean hasDomainTerm = DOMAIN_TERMS.matcher(trimmed).find();
        if (PRONOUN.matcher(trimmed).find() && !hasDomainTerm) {
            indicators.add(PRONOUN_AMBIGUITY);
            score += 0.25;
        }
        if (!hasDomainTerm) {
            indicators.add(MISSING_DOMAIN_TERMS);
            score += 0.15;
        }
        score = Math.min(1.0, score);
        boolean hasHistory = history != null && !history.isEmpty();
        if (score >= MULTI_VARIANT_THRESHOLD) {
            int variants = score >= THREE_VARIANTS_THRESHOLD ? 3 : 2;
            return new AmbiguityAssessment(score, indicators, AmbiguityStrategy.MULTI_VARIANT, variants);
        }
        if (hasHistory && !indicators.isEmpty()) {
            return new AmbiguityAssessment(score, indicators, AmbiguityStrategy.CONVERSATIONAL, 1);
        }
        return new AmbiguityAssessment(score, indicators, AmbiguityStrategy.STANDARD, 1);
    }
}
