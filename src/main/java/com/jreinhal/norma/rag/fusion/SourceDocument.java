package com.jreinhal.norma.rag.fusion;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A hit returned by a search provider, before fusion.
 */
public record SourceDocument(String id, String content, String sourceName, SourceType sourceType,
                             LocalDate publishedDate, double score, Map<String, Object> metadata) {

    public static final String TYPE_KEY = "source_type";
    public static final String TITLE_KEY = "title";
    public static final String SOURCE_KEY = "source";
    public static final String PUBLISHED_KEY = "published_date";
    public static final String REFERENCE_KEY = "reference";

    public SourceDocument {
        content = content == null ? "" : content;
        sourceType = sourceType == null ? SourceType.UNKNOWN : sourceType;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Builds a hit from free-form index metadata ({@code source_type}, {@code title},
     * {@code source}, {@code published_date}, {@code reference}).
     */
    public static SourceDocument fromMetadata(String id, String content, Map<String, Object> metadata, Double score) {
        Map<String, Object> meta = metadata == null ? Map.of() : metadata;
        String title = stringValue(meta.get(TITLE_KEY));
        String source = stringValue(meta.get(SOURCE_KEY));
        String reference = stringValue(meta.get(REFERENCE_KEY));
        String name = !title.isBlank() ? title : (!reference.isBlank() ? reference : (!source.isBlank() ? source : id));
        SourceType type = SourceType.resolve(stringValue(meta.get(TYPE_KEY)));
        if (type == SourceType.UNKNOWN) {
            type = SourceType.infer(!reference.isBlank() ? reference : name);
        }
        return new SourceDocument(id, content, name, type, parseDate(meta.get(PUBLISHED_KEY)),
                score == null ? 0.0 : score, stripNulls(meta));
    }

    static LocalDate parseDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        }
        String text = value.toString().trim();
        if (text.length() >= 10) {
            text = text.substring(0, 10);
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Map<String, Object> stripNulls(Map<String, Object> meta) {
        Map<String, Object> copy = new LinkedHashMap<>();
        meta.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }

    private static String stringValue(Object value) {
        return value == null ? "" : value.toString().trim();
    }
}
