package com.jreinhal.norma.rag.router;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * How a question is handled downstream.
 */
public enum RoutingCategory {
    /** Greetings, thanks, small talk: answered directly, no retrieval. */
    CASUAL_CHAT("casual_chat", Set.of("chitchat", "chit_chat", "casual")),
    /** "Cos'è...", "Che cosa si intende per...": definitions of concepts. */
    DEFINITIONAL("definitional", Set.of("theoretical_definition", "definition")),
    /** Normative or procedural research: full retrieval. */
    TECHNICAL_RESEARCH("technical_research", Set.of("technical", "research", "normative_reference")),
    /** Numeric computations: retrieval for the rules, no hypothetical document. */
    CALCULATION("calculation", Set.of("calculator", "calc")),
    /** Questions covered by the curated answer set. */
    FIXED_ANSWER_SET("fixed_answer_set", Set.of("golden_set", "faq"));

    private final String wireName;
    private final Set<String> aliases;

    RoutingCategory(String wireName, Set<String> aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    public String wireName() {
        return this.wireName;
    }

    public boolean needsRetrieval() {
        return this != CASUAL_CHAT;
    }

    public static Optional<RoutingCategory> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RoutingCategory category : values()) {
            if (category.wireName.equals(normalized) || category.aliases.contains(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
