package com.jreinhal.norma.rag.expansion;

public enum AmbiguityStrategy {
    /** One hypothetical document from the question alone. */
    STANDARD,
    /** One hypothetical document that folds in the recent conversation. */
    CONVERSATIONAL,
    /** Two or three hypothetical documents, one per plausible reading. */
    MULTI_VARIANT
}
