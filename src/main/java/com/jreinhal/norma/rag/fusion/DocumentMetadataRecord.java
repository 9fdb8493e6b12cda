package com.jreinhal.norma.rag.fusion;

import java.util.List;

/**
 * Derived facts about a retrieved document, shared by fusion boosting, conflict detection
 * and follow-up action grounding.
 */
public record DocumentMetadataRecord(double hierarchyWeight, List<String> keyTopics, List<String> keyValues,
                                     String referenceCode) {

    public DocumentMetadataRecord {
        keyTopics = keyTopics == null ? List.of() : List.copyOf(keyTopics);
        keyValues = keyValues == null ? List.of() : List.copyOf(keyValues);
    }
}
