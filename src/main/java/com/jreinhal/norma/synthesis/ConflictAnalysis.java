package com.jreinhal.norma.synthesis;

import java.util.List;

public record ConflictAnalysis(List<SourceConflict> conflicts, String summary) {

    public ConflictAnalysis {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static ConflictAnalysis none() {
        return new ConflictAnalysis(List.of(), null);
    }

    public boolean hasConflicts() {
        return !this.conflicts.isEmpty();
    }
}
