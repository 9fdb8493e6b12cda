package com.jreinhal.norma.support;

import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.rag.fusion.DocumentMetadataExtractor;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.SourceDocument;
import com.jreinhal.norma.rag.fusion.SourceType;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builders for retrieved documents and model replies shared by unit tests.
 */
public final class TestDocuments {
    private static final DocumentMetadataExtractor EXTRACTOR = new DocumentMetadataExtractor();

    private TestDocuments() {
    }

    public static SourceDocument source(String id, String content, String reference, SourceType type, LocalDate date, double score) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (reference != null) {
            meta.put(SourceDocument.REFERENCE_KEY, reference);
        }
        return new SourceDocument(id, content, reference != null ? reference : id, type, date, score, meta);
    }

    public static RankedDocument ranked(String id, String content, String reference, SourceType type, LocalDate date) {
        return ranked(id, content, reference, type, date, 0.01);
    }

    public static RankedDocument ranked(String id, String content, String reference, SourceType type, LocalDate date,
                                        double fusedScore) {
        SourceDocument source = source(id, content, reference, type, date, 0.8);
        return new RankedDocument(id, content, source.sourceName(), type, date, Map.of(), fusedScore, source.metadata(),
                EXTRACTOR.extract(source, type.defaultWeight()));
    }

    public static ModelReply reply(String text) {
        return new ModelReply(text, "openai", "gpt-4o-mini", ModelTier.BASIC, 100, 50, 0.0001, 20L, false);
    }

    public static ModelReply reply(String text, ModelTier tier) {
        return new ModelReply(text, "openai", tier == ModelTier.ADVANCED ? "gpt-4o" : "gpt-4o-mini", tier, 100, 50,
                0.0001, 20L, false);
    }
}
