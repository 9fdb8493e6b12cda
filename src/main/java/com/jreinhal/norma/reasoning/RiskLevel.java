package com.jreinhal.norma.reasoning;

import java.util.Locale;

/**
 * Severity of the sanction exposure a scenario implies, independent of its probability.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isFlagged() {
        return this == HIGH || this == CRITICAL;
    }

    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) {
            return b == null ? LOW : b;
        }
        if (b == null) {
            return a;
        }
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public static RiskLevel fromLabel(String label) {
        if (label == null) {
            return null;
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "critico", "critica" -> CRITICAL;
            case "high", "alto", "alta", "elevato" -> HIGH;
            case "medium", "medio", "media" -> MEDIUM;
            case "low", "basso", "bassa" -> LOW;
            default -> null;
        };
    }
}
