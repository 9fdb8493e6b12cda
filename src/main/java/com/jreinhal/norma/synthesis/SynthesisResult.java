package com.jreinhal.norma.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import java.util.List;

/**
 * Output of the synthesis stage. {@code needsRegeneration} asks the Golden Loop to produce
 * actions even though none were parsed.
 */
public record SynthesisResult(String answerText, String reasoningSummary, ReasoningTrace reasoningTrace,
                              List<CitedSource> sourcesCited, List<CandidateAction> candidateActions,
                              JsonNode structuredQuestion, ConflictAnalysis conflicts, boolean needsRegeneration,
                              boolean degraded, String disclaimer) {

    public SynthesisResult {
        sourcesCited = sourcesCited == null ? List.of() : List.copyOf(sourcesCited);
        candidateActions = candidateActions == null ? List.of() : List.copyOf(candidateActions);
        conflicts = conflicts == null ? ConflictAnalysis.none() : conflicts;
    }
}
