package com.jreinhal.norma.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.foundation.CostSnapshot;
import com.jreinhal.norma.reasoning.PublicReasoning;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import com.jreinhal.norma.synthesis.CandidateAction;
import com.jreinhal.norma.synthesis.CitedSource;
import com.jreinhal.norma.synthesis.SourceConflict;
import java.util.List;
import java.util.Map;

/**
 * Payload handed to the transport layer. {@code reasoningTrace} is the technical trace and
 * may be omitted by configuration; {@code publicReasoning} is safe to display.
 */
public record QueryAnswerResponse(String answer,
                                  List<CitedSource> sourcesCited,
                                  List<CandidateAction> suggestedActions,
                                  JsonNode structuredQuestion,
                                  ReasoningTrace reasoningTrace,
                                  PublicReasoning publicReasoning,
                                  List<SourceConflict> conflicts,
                                  String conflictSummary,
                                  String category,
                                  String complexity,
                                  boolean degraded,
                                  String disclaimer,
                                  CostSnapshot cost,
                                  List<Map<String, Object>> stages,
                                  String traceId,
                                  String sessionId) {

    public QueryAnswerResponse {
        sourcesCited = sourcesCited == null ? List.of() : List.copyOf(sourcesCited);
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        stages = stages == null ? List.of() : List.copyOf(stages);
    }
}
