package com.jreinhal.norma.streaming;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Strips structural tags from streamed model output. Tags may be split across chunks, so
 * the filter is a four-state machine that buffers only while a tag is still ambiguous.
 * {@code <answer>} content passes through; {@code <suggested_actions>},
 * {@code <structured_question>} and {@code <reasoning>} content is captured instead of
 * shown. Any other {@code <} sequence is ordinary text.
 *
 * <p>Not thread-safe: one instance per stream.
 */
public class StreamingTagFilter {
    public static final String ANSWER = "answer";
    public static final String SUGGESTED_ACTIONS = "suggested_actions";
    public static final String STRUCTURED_QUESTION = "structured_question";
    public static final String REASONING = "reasoning";

    private static final Set<String> PASS_THROUGH_TAGS = Set.of("<" + ANSWER + ">", "</" + ANSWER + ">");
    private static final Set<String> CAPTURE_TAGS = Set.of(SUGGESTED_ACTIONS, STRUCTURED_QUESTION, REASONING);

    enum State {
        OUTSIDE_TAG,
        IN_OPEN_TAG,
        IN_CONTENT,
        IN_CLOSE_TAG
    }

    private State state = State.OUTSIDE_TAG;
    private final StringBuilder tagBuffer = new StringBuilder();
    private final StringBuilder captureBuffer = new StringBuilder();
    private String captureTag;
    private final Map<String, String> captures = new LinkedHashMap<>();

    /**
     * Feeds one chunk and returns the text that is safe to show now (possibly empty).
     */
    public String accept(String chunk) {
        StringBuilder visible = new StringBuilder();
        if (chunk == null) {
            return "";
        }
        for (int i = 0; i < chunk.length(); i++) {
            this.step(chunk.charAt(i), visible);
        }
        return visible.toString();
    }

    /**
     * Ends the stream: a dangling partial tag is released as text, an unterminated capture
     * is kept as captured.
     */
    public String finish() {
        StringBuilder visible = new StringBuilder();
        switch (this.state) {
            case IN_OPEN_TAG -> visible.append(this.tagBuffer);
            case IN_CONTENT, IN_CLOSE_TAG -> {
                this.captureBuffer.append(this.tagBuffer);
                this.closeCapture();
            }
            case OUTSIDE_TAG -> {
            }
        }
        this.tagBuffer.setLength(0);
        this.state = State.OUTSIDE_TAG;
        return visible.toString();
    }

    public Optional<String> captured(String tag) {
        return Optional.ofNullable(this.captures.get(tag));
    }

    State state() {
        return this.state;
    }

    private void step(char c, StringBuilder visible) {
        switch (this.state) {
            case OUTSIDE_TAG -> {
                if (c == '<') {
                    this.tagBuffer.setLength(0);
                    this.tagBuffer.append(c);
                    this.state = State.IN_OPEN_TAG;
                } else {
                    visible.append(c);
                }
            }
            case IN_OPEN_TAG -> {
                this.tagBuffer.append(c);
                String candidate = this.tagBuffer.toString();
                if (PASS_THROUGH_TAGS.contains(candidate)) {
                    this.tagBuffer.setLength(0);
                    this.state = State.OUTSIDE_TAG;
                } else if (c == '>' && isCaptureOpen(candidate)) {
                    this.captureTag = candidate.substring(1, candidate.length() - 1);
                    this.captureBuffer.setLength(0);
                    this.tagBuffer.setLength(0);
                    this.state = State.IN_CONTENT;
                } else if (!isKnownTagPrefix(candidate)) {
                    this.tagBuffer.setLength(this.tagBuffer.length() - 1);
                    visible.append(this.tagBuffer);
                    this.tagBuffer.setLength(0);
                    this.state = State.OUTSIDE_TAG;
                    this.step(c, visible);
                }
            }
            case IN_CONTENT -> {
                if (c == '<') {
                    this.tagBuffer.setLength(0);
                    this.tagBuffer.append(c);
                    this.state = State.IN_CLOSE_TAG;
                } else {
                    this.captureBuffer.append(c);
                }
            }
            case IN_CLOSE_TAG -> {
                this.tagBuffer.append(c);
                String expected = "</" + this.captureTag + ">";
                String candidate = this.tagBuffer.toString();
                if (candidate.equals(expected)) {
                    this.tagBuffer.setLength(0);
                    this.closeCapture();
                    this.state = State.OUTSIDE_TAG;
                } else if (!expected.startsWith(candidate)) {
                    this.tagBuffer.setLength(this.tagBuffer.length() - 1);
                    this.captureBuffer.append(this.tagBuffer);
                    this.tagBuffer.setLength(0);
                    this.state = State.IN_CONTENT;
                    this.step(c, visible);
                }
            }
        }
    }

    private void closeCapture() {
        if (this.captureTag != null) {
            this.captures.put(this.captureTag, this.captureBuffer.toString().trim());
        }
        this.captureTag = null;
        this.captureBuffer.setLength(0);
    }

    private static boolean isCaptureOpen(String candidate) {
        return CAPTURE_TAGS.contains(candidate.substring(1, candidate.length() - 1));
    }

    private static boolean isKnownTagPrefix(String candidate) {
        for (String tag : PASS_THROUGH_TAGS) {
            if (tag.startsWith(candidate)) {
                return true;
            }
        }
        for (String tag : CAPTURE_TAGS) {
            if (("<" + tag + ">").startsWith(candidate)) {
                return true;
            }
        }
        return false;
    }
}
