package com.jreinhal.norma.rag.router;

/**
 * Entity mentioned in the question: a law reference, tax, form, deadline, amount.
 */
public record ExtractedEntity(String text, String type, double confidence) {
}
