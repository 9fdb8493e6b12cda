package com.jreinhal.norma.reasoning;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Assigns each hypothesis the worst sanction exposure it describes. The level is the
 * maximum of what the model declared and what the text itself reveals, so a
 * criminal-liability scenario cannot be understated by the model.
 */
@Component
public class RiskAnalyzer {

    private static final Pattern CRITICAL = Pattern.compile(
            "\\b(penal[ei]|reat[oi]|frod[ei]|fraudolent[aoie]|reclusione|arresto|sequestro|confisca|bancarotta|"
                    + "fatture\\s+false|false\\s+fatture|operazioni\\s+inesistenti|criminal[ei]?|fraud)\\b");
    private static final Pattern HIGH = Pattern.compile(
            "\\b(evasione|omessa\\s+dichiarazione|dichiarazione\\s+infedele|accertament[oi]|recupero\\s+a\\s+tassazione|"
                    + "decadenza|disconosciment[oi]|abuso\\s+del\\s+diritto|elusione)\\b|\\b(90|100|120|180|240)\\s?%");
    private static final Pattern MEDIUM = Pattern.compile(
            "\\b(sanzion[ei]|interessi\\s+di\\s+mora|interessi|ravvediment[oi]|maggiorazion[ei]|penalit[àa]|rettifica|"
                    + "contestazion[ei])\\b");

    public Hypothesis analyze(Hypothesis hypothesis) {
        String text = (nullToEmpty(hypothesis.path()) + " " + nullToEmpty(hypothesis.conclusion()) + " "
                + String.join(" ", hypothesis.riskFactors())).toLowerCase(Locale.ITALIAN);
        Set<String> factors = new LinkedHashSet<>(hypothesis.riskFactors());
        RiskLevel detected = RiskLevel.LOW;
        if (collect(CRITICAL, text, factors)) {
            detected = RiskLevel.CRITICAL;
        } else if (collect(HIGH, text, factors)) {
            detected = RiskLevel.HIGH;
        } else if (collect(MEDIUM, text, factors)) {
            detected = RiskLevel.MEDIUM;
        }
        return hypothesis.withRisk(RiskLevel.max(hypothesis.riskLevel(), detected), new ArrayList<>(factors));
    }

    public List<Hypothesis> analyzeAll(List<Hypothesis> hypotheses) {
        List<Hypothesis> analyzed = new ArrayList<>(hypotheses.size());
        for (Hypothesis hypothesis : hypotheses) {
            analyzed.add(this.analyze(hypothesis));
        }
        return analyzed;
    }

    private static boolean collect(Pattern pattern, String text, Set<String> factors) {
        Matcher matcher = pattern.matcher(text);
        boolean found = false;
        while (matcher.find()) {
            factors.add(matcher.group().trim());
            found = true;
        }
        return found;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
