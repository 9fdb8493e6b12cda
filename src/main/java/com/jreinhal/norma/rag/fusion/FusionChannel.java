package com.jreinhal.norma.rag.fusion;

/**
 * One ranked list fed into reciprocal-rank fusion: which query text ran on which backend.
 */
public enum FusionChannel {
    /** Keyword variant on lexical search. */
    LEXICAL(SearchBackend.LEXICAL),
    /** Semantic variant on vector search. */
    VECTOR(SearchBackend.VECTOR),
    /** Hypothetical document(s) on vector search. */
    HYPOTHETICAL(SearchBackend.VECTOR),
    /** Entity variant on entity-aware search. */
    ENTITY(SearchBackend.ENTITY);

    private final SearchBackend backend;

    FusionChannel(SearchBackend backend) {
        this.backend = backend;
    }

    public SearchBackend backend() {
        return this.backend;
    }
}
