package com.jreinhal.norma.rag.expansion;

import java.util.List;

public record AmbiguityAssessment(double score, List<String> indicators, AmbiguityStrategy strategy, int variantCount) {

    public AmbiguityAssessment {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }

    public boolean isAmbiguous() {
        return this.strategy == AmbiguityStrategy.MULTI_VARIANT;
    }
}
