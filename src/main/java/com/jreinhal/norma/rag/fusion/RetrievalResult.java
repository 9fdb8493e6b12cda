package com.jreinhal.norma.rag.fusion;

import java.util.List;
import java.util.Map;

/**
 * Fused, boosted, deduplicated top-K. Ids are unique and documents are sorted by
 * {@code fusedScore} descending.
 */
public record RetrievalResult(List<RankedDocument> documents, Map<FusionChannel, Integer> channelHits,
                              List<FusionChannel> failedChannels, long latencyMs) {

    public RetrievalResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
        channelHits = channelHits == null ? Map.of() : Map.copyOf(channelHits);
        failedChannels = failedChannels == null ? List.of() : List.copyOf(failedChannels);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), Map.of(), List.of(), 0L);
    }

    public boolean isEmpty() {
        return this.documents.isEmpty();
    }
}
