package com.jreinhal.norma.rag.fusion;

import java.time.LocalDate;
import java.util.Map;

public record RankedDocument(String id, String content, String sourceName, SourceType sourceType,
                             LocalDate publishedDate, Map<FusionChannel, Double> rawScores, double fusedScore,
                             Map<String, Object> metadata, DocumentMetadataRecord metadataRecord) {

    public RankedDocument {
        rawScores = rawScores == null ? Map.of() : Map.copyOf(rawScores);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String reference() {
        if (this.metadataRecord != null && this.metadataRecord.referenceCode() != null) {
            return this.metadataRecord.referenceCode();
        }
        return this.sourceName != null ? this.sourceName : this.id;
    }
}
