package com.jreinhal.norma.synthesis;

import com.jreinhal.norma.rag.fusion.SourceType;
import java.time.LocalDate;

/**
 * A source the answer relies on. {@code documentId} is null when the citation could not be
 * matched to a retrieved document.
 */
public record CitedSource(String reference, String documentId, SourceType sourceType, int hierarchyRank,
                          double relevance, LocalDate publishedDate) {

    public boolean isResolved() {
        return this.documentId != null;
    }
}
