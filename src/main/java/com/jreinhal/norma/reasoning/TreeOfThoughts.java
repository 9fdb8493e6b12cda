package com.jreinhal.norma.reasoning;

import java.util.List;
import java.util.Optional;

/**
 * Scored hypotheses with the selected one and the high-risk alternatives that must be
 * surfaced regardless of selection.
 */
public record TreeOfThoughts(List<Hypothesis> hypotheses, String selectedHypothesisId, String selectionReasoning,
                             List<String> flaggedAlternativeIds, List<DomainConflict> domainConflicts,
                             boolean needsReview, boolean multiDomain) {

    public TreeOfThoughts {
        hypotheses = hypotheses == null ? List.of() : List.copyOf(hypotheses);
        flaggedAlternativeIds = flaggedAlternativeIds == null ? List.of() : List.copyOf(flaggedAlternativeIds);
        domainConflicts = domainConflicts == null ? List.of() : List.copyOf(domainConflicts);
    }

    public Optional<Hypothesis> selected() {
        return this.hypotheses.stream().filter(h -> h.id().equals(this.selectedHypothesisId)).findFirst();
    }

    public List<Hypothesis> flaggedAlternatives() {
        return this.hypotheses.stream().filter(h -> this.flaggedAlternativeIds.contains(h.id())).toList();
    }
}
