package com.jreinhal.norma.rag.expansion;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Three reformulations of one question, each aimed at a different search strategy.
 *
 * @param keywordVariant  for lexical search
 * @param semanticVariant for vector search
 * @param entityVariant   for entity-aware search
 * @param degraded        true when expansion failed and all variants equal the original
 */
public record QueryVariantSet(String originalQuery, String keywordVariant, String semanticVariant,
                              String entityVariant, boolean degraded) {

    public static QueryVariantSet passthrough(String query) {
        return new QueryVariantSet(query, query, query, query, true);
    }

    public List<String> distinctVariants() {
        return new ArrayList<>(new LinkedHashSet<>(List.of(this.keywordVariant, this.semanticVariant, this.entityVariant)));
    }
}
