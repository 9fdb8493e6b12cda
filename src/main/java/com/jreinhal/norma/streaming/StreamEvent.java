package com.jreinhal.norma.streaming;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.synthesis.CandidateAction;
import java.util.List;

/**
 * One event of a streamed answer: CONTENT deltas, then ACTIONS, an optional QUESTION,
 * ERROR on failure, and always a final DONE.
 */
public record StreamEvent(Type type, String content, List<CandidateAction> actions, JsonNode question) {

    public enum Type {
        CONTENT,
        ACTIONS,
        QUESTION,
        ERROR,
        DONE
    }

    public StreamEvent {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static StreamEvent content(String text) {
        return new StreamEvent(Type.CONTENT, text, List.of(), null);
    }

    public static StreamEvent actions(List<CandidateAction> actions) {
        return new StreamEvent(Type.ACTIONS, null, actions, null);
    }

    public static StreamEvent question(JsonNode question) {
        return new StreamEvent(Type.QUESTION, null, List.of(), question);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(Type.ERROR, message, List.of(), null);
    }

    public static StreamEvent done() {
        return new StreamEvent(Type.DONE, null, List.of(), null);
    }
}
