package com.jreinhal.norma.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> ITALIAN = Set.of(
            "il", "lo", "la", "i", "gli", "le", "un", "uno", "una", "di", "a", "da", "in",
            "con", "su", "per", "tra", "fra", "del", "dello", "della", "dei", "degli", "delle",
            "al", "allo", "alla", "ai", "agli", "alle", "dal", "dalla", "dai", "dalle", "nel",
            "nello", "nella", "nei", "negli", "nelle", "sul", "sulla", "sui", "sulle", "e", "ed",
            "o", "ma", "se", "che", "chi", "cui", "non", "come", "dove", "quando", "quale",
            "quali", "quanto", "quanta", "quanti", "perché", "è", "sono", "era", "essere",
            "ha", "hanno", "ho", "avere", "questo", "questa", "questi", "queste", "quello",
            "quella", "quelli", "quelle", "anche", "più", "già", "ancora", "cosa", "mi", "ti",
            "si", "ci", "vi", "ne", "loro", "suo", "sua", "suoi", "sue", "l", "d", "all",
            "dell", "nell", "sull", "qual", "deve", "può", "viene", "sia"
    );

    /**
     * Words too weak to carry a label's meaning when comparing follow-up actions.
     */
    public static final Set<String> ACTION_LABELS = Set.of(
            "il", "lo", "la", "i", "gli", "le", "un", "uno", "una", "di", "a", "da", "in",
            "con", "su", "per", "del", "della", "dei", "delle", "al", "alla", "e", "o",
            "the", "an", "of", "for", "to", "and", "on"
    );

    private StopWords() {
    }
}
