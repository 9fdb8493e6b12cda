package com.jreinhal.norma.model;

import java.util.List;
import java.util.UUID;

public record PipelineRequest(String query, List<ConversationTurn> history, String attachedDocument,
                              String sessionId, String requestId) {

    public PipelineRequest {
        history = history == null ? List.of() : List.copyOf(history);
        sessionId = sessionId == null || sessionId.isBlank() ? "anonymous" : sessionId;
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }

    public static PipelineRequest of(String query) {
        return new PipelineRequest(query, List.of(), null, null, null);
    }

    public boolean hasHistory() {
        return !this.history.isEmpty();
    }

    public boolean hasAttachedDocument() {
        return this.attachedDocument != null && !this.attachedDocument.isBlank();
    }
}
