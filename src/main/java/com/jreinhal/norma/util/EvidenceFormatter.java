package com.jreinhal.norma.util;

import com.jreinhal.norma.rag.fusion.RankedDocument;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared formatting of retrieved evidence for prompts, and resolution of the citations
 * a model writes back ("[2]", "S2", "Circolare 18/E/2024", a document id).
 */
public final class EvidenceFormatter {
    private static final Pattern INDEX = Pattern.compile("^\\s*\\[?\\s*(?:S|fonte\\s*)?(\\d{1,2})\\s*]?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_INDEX = Pattern.compile("^\\s*\\[(\\d{1,2})]");

    private EvidenceFormatter() {
    }

    public static String format(List<RankedDocument> documents, int maxDocuments, int maxChars) {
        if (documents == null || documents.isEmpty()) {
            return "(nessuna fonte disponibile)";
        }
        StringBuilder sb = new StringBuilder();
        int limit = Math.min(maxDocuments, documents.size());
        for (int i = 0; i < limit; i++) {
            RankedDocument doc = documents.get(i);
            sb.append('[').append(i + 1).append("] ").append(doc.reference())
                    .append(" (").append(doc.sourceType().label());
            if (doc.publishedDate() != null) {
                sb.append(", ").append(doc.publishedDate());
            }
            sb.append(")\n").append(truncate(doc.content(), maxChars)).append("\n\n");
        }
        return sb.toString().trim();
    }

    public static Optional<RankedDocument> resolve(String citation, List<RankedDocument> documents) {
        if (citation == null || citation.isBlank() || documents == null || documents.isEmpty()) {
            return Optional.empty();
        }
        Matcher index = INDEX.matcher(citation);
        if (!index.matches()) {
            index = LEADING_INDEX.matcher(citation);
            if (!index.find()) {
                index = null;
            }
        }
        if (index != null) {
            int position = Integer.parseInt(index.group(1));
            if (position >= 1 && position <= documents.size()) {
                return Optional.of(documents.get(position - 1));
            }
        }
        String needle = normalize(citation);
        for (RankedDocument doc : documents) {
            if (needle.equals(normalize(doc.id())) || needle.equals(normalize(doc.reference()))) {
                return Optional.of(doc);
            }
        }
        for (RankedDocument doc : documents) {
            String reference = normalize(doc.reference());
            String name = normalize(doc.sourceName());
            if ((!reference.isEmpty() && (needle.contains(reference) || reference.contains(needle)))
                    || (!name.isEmpty() && needle.length() >= 6 && (name.contains(needle) || needle.contains(name)))) {
                return Optional.of(doc);
            }
        }
        return Optional.empty();
    }

    public static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= maxChars ? trimmed : trimmed.substring(0, maxChars) + "...";
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ITALIAN).replaceAll("[\\s.]+", " ").trim();
    }
}
