package com.jreinhal.norma.rag.fusion;

import java.util.List;

/**
 * One provider's answer for one query text, best hit first.
 */
public record RankedList(FusionChannel channel, List<SourceDocument> documents) {

    public RankedList {
        documents = documents == null ? List.of() : List.copyOf(documents);
    }
}
