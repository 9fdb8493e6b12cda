package com.jreinhal.norma.reasoning;

import java.util.List;

/**
 * Single linear justification from evidence to conclusion. {@code confidence} is null
 * when the model did not state one.
 */
public record ChainOfThought(String theme, List<String> sourcesUsed, List<String> keyPoints, String conclusion,
                             Double confidence) {

    public ChainOfThought {
        sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
        keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
    }
}
