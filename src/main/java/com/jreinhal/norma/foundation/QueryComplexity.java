package com.jreinhal.norma.foundation;

import java.util.Locale;

public enum QueryComplexity {
    SIMPLE,
    COMPLEX,
    MULTI_DOMAIN;

    /**
     * Lenient parse of the classifier's label. "moderate" counts as simple; unknown labels yield null.
     */
    public static QueryComplexity fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "simple", "semplice", "moderate", "moderata" -> SIMPLE;
            case "complex", "complessa", "complesso" -> COMPLEX;
            case "multi_domain", "multidomain", "multi_dominio" -> MULTI_DOMAIN;
            default -> null;
        };
    }
}
