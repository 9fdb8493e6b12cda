package com.jreinhal.norma.rag.expansion;

import com.jreinhal.norma.rag.hyde.HypotheticalDocument;

/**
 * Everything retrieval needs from the expansion stage.
 */
public record QueryExpansion(QueryVariantSet variants, HypotheticalDocument hypotheticalDocument,
                             AmbiguityAssessment ambiguity) {
}
