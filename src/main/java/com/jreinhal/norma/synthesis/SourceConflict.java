package com.jreinhal.norma.synthesis;

public record SourceConflict(Type type, Severity severity, String preferredReference, String otherReference,
                             String topic, String resolution) {

    public enum Type {
        HIERARCHY,
        TEMPORAL
    }

    public enum Severity {
        HIGH,
        MEDIUM
    }
}
