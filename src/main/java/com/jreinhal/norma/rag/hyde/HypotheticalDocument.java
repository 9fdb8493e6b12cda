package com.jreinhal.norma.rag.hyde;

import com.jreinhal.norma.rag.expansion.AmbiguityStrategy;
import java.util.ArrayList;
import java.util.List;

/**
 * Model-written answer-like passage used only as a vector search query. Never shown to users.
 *
 * <p>For ambiguous questions {@link #variants()} holds one passage per plausible reading;
 * each is searched and fused as its own ranked list.</p>
 */
public record HypotheticalDocument(String text, int wordCount, boolean skipped, String skipReason,
                                   AmbiguityStrategy strategy, List<Variant> variants) {

    public HypotheticalDocument {
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public static HypotheticalDocument skipped(String reason) {
        return new HypotheticalDocument(null, 0, true, reason, AmbiguityStrategy.STANDARD, List.of());
    }

    public static HypotheticalDocument single(String text, AmbiguityStrategy strategy) {
        return new HypotheticalDocument(text, countWords(text), false, null, strategy, List.of());
    }

    public static HypotheticalDocument multi(List<Variant> variants) {
        Variant first = variants.get(0);
        return new HypotheticalDocument(first.text(), first.wordCount(), false, null, AmbiguityStrategy.MULTI_VARIANT, variants);
    }

    /**
     * Texts to run through vector search: every variant, or the single passage.
     */
    public List<String> searchTexts() {
        List<String> texts = new ArrayList<>();
        if (this.skipped) {
            return texts;
        }
        if (!this.variants.isEmpty()) {
            for (Variant variant : this.variants) {
                texts.add(variant.text());
            }
        } else if (this.text != null && !this.text.isBlank()) {
            texts.add(this.text);
        }
        return texts;
    }

    public static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    public record Variant(String interpretation, String text, int wordCount) {
    }
}
