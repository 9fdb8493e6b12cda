package com.jreinhal.norma.rag.router;

import java.util.List;

public record RoutingDecision(RoutingCategory category, double confidence, String reasoning,
                              List<ExtractedEntity> extractedEntities, boolean requiresFreshness, boolean fallback) {

    public static final double FALLBACK_CONFIDENCE = 0.5;

    public RoutingDecision {
        extractedEntities = extractedEntities == null ? List.of() : List.copyOf(extractedEntities);
    }

    /**
     * The safe default: full retrieval. Never casual chat.
     */
    public static RoutingDecision fallback(String reason) {
        return new RoutingDecision(RoutingCategory.TECHNICAL_RESEARCH, FALLBACK_CONFIDENCE,
                "fallback: " + reason, List.of(), false, true);
    }
}
