package com.jreinhal.norma.foundation;

import java.util.List;

public record ComplexityClassification(QueryComplexity complexity, List<String> domains, double confidence,
                                       String reasoning, boolean fallback) {

    public ComplexityClassification {
        complexity = complexity == null ? QueryComplexity.SIMPLE : complexity;
        domains = domains == null ? List.of() : List.copyOf(domains);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static ComplexityClassification fallback(List<String> domainsHint, String reason) {
        return new ComplexityClassification(QueryComplexity.SIMPLE, domainsHint, 0.5,
                "Classificazione di fallback: " + reason, true);
    }
}
