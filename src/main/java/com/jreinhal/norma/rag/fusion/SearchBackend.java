package com.jreinhal.norma.rag.fusion;

public enum SearchBackend {
    LEXICAL,
    VECTOR,
    ENTITY
}
