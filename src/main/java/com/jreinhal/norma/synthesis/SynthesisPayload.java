package com.jreinhal.norma.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * What the parser could recover from one synthesis output. {@code structured} is false
 * when the raw text was taken as the answer.
 */
public record SynthesisPayload(String answerText, String reasoningSummary, List<CitedSource> sourcesCited,
                               List<CandidateAction> candidateActions, JsonNode structuredQuestion, boolean structured) {

    public SynthesisPayload {
        sourcesCited = sourcesCited == null ? List.of() : List.copyOf(sourcesCited);
        candidateActions = candidateActions == null ? List.of() : List.copyOf(candidateActions);
    }

    public static SynthesisPayload rawText(String text) {
        return new SynthesisPayload(text == null ? "" : text.trim(), null, List.of(), List.of(), null, false);
    }
}
