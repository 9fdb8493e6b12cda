package com.jreinhal.norma.rag.fusion;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Legal-hierarchy tag of a source. {@link #rank()} orders authority: 1 is the strongest.
 */
public enum SourceType {
    LAW("legge", 1, 1.3),
    DECREE("decreto", 2, 1.25),
    CIRCULAR("circolare", 3, 1.15),
    RESOLUTION("risoluzione", 4, 1.1),
    RULING("interpello", 5, 1.05),
    FAQ("faq", 6, 1.0),
    GUIDE("guida", 7, 0.95),
    UNKNOWN("altro", 8, 1.0);

    private final String label;
    private final int rank;
    private final double defaultWeight;

    // Checked in order: a circular's reference often also names the law it interprets.
    private static final List<Rule> RULES = List.of(
            new Rule(CIRCULAR, Pattern.compile("\\bcircolar[ei]\\b|\\bcirc\\.")),
            new Rule(RESOLUTION, Pattern.compile("\\brisoluzion[ei]\\b|\\bris\\.")),
            new Rule(RULING, Pattern.compile("\\binterpell[oi]\\b|\\brisposta\\b|\\bprincipio di diritto\\b|\\bruling\\b")),
            new Rule(FAQ, Pattern.compile("\\bfaq\\b|domande frequenti")),
            new Rule(GUIDE, Pattern.compile("\\bguid[ae]\\b|\\bvademecum\\b|\\bguide\\b|\\bmanuale\\b")),
            new Rule(DECREE, Pattern.compile("\\bdecret[oi]\\b|\\bd\\.\\s?lgs\\b|\\bdlgs\\b|\\bd\\.\\s?p\\.\\s?r\\b|\\bdpr\\b|\\bd\\.\\s?m\\.|\\bdpcm\\b|\\bd\\.\\s?l\\.|\\bdecree\\b")),
            new Rule(LAW, Pattern.compile("\\blegge\\b|\\bl\\.\\s*\\d|\\bcodice\\b|\\btuir\\b|\\btesto unico\\b|\\bcostituzione\\b|\\blaw\\b|\\bstatute\\b")));

    SourceType(String label, int rank, double defaultWeight) {
        this.label = label;
        this.rank = rank;
        this.defaultWeight = defaultWeight;
    }

    public String label() {
        return this.label;
    }

    public int rank() {
        return this.rank;
    }

    public double defaultWeight() {
        return this.defaultWeight;
    }

    /**
     * Resolves an explicit type label ("legge", "CIRCULAR") or, failing that, infers the
     * type from a citation or title such as "Circolare 18/E del 2024" or "D.Lgs. 471/1997".
     */
    public static SourceType resolve(String typeOrReference) {
        if (typeOrReference == null || typeOrReference.isBlank()) {
            return UNKNOWN;
        }
        String value = typeOrReference.trim();
        for (SourceType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.label.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return infer(value);
    }

    public static SourceType infer(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ITALIAN);
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(lower).find()) {
                return rule.type();
            }
        }
        return UNKNOWN;
    }

    private record Rule(SourceType type, Pattern pattern) {
    }
}
