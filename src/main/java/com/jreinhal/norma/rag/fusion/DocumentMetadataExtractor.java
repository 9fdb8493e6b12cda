package com.jreinhal.norma.rag.fusion;

import com.jreinhal.norma.constant.StopWords;
import com.jreinhal.norma.util.ValueExtractor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class DocumentMetadataExtractor {
    private static final int MAX_TOPICS = 8;
    private static final int MAX_VALUES = 10;
    private static final int FREQUENT_TERMS = 4;

    private static final List<String> FISCAL_TERMS = List.of(
            "aliquota", "iva", "irpef", "ires", "irap", "imu", "regime forfettario", "forfettario", "detrazione",
            "deduzione", "credito d'imposta", "ravvedimento", "sanzione", "fattura elettronica", "split payment",
            "reverse charge", "esenzione", "rimborso", "dichiarazione", "f24", "cedolare secca", "tfr", "contributi",
            "inps", "inail", "ccnl", "licenziamento", "assunzione", "bollo", "successione", "plusvalenza");

    private static final Pattern WORD = Pattern.compile("[\\p{L}']{5,}");

    private static final List<ReferencePattern> REFERENCE_PATTERNS = List.of(
            new ReferencePattern(Pattern.compile("(?i)\\bcircolare\\s+(?:n\\.?\\s*)?(\\d+/[A-Z])"), "Circolare %s", true),
            new ReferencePattern(Pattern.compile("(?i)\\brisoluzione\\s+(?:n\\.?\\s*)?(\\d+/[A-Z])"), "Risoluzione %s", true),
            new ReferencePattern(Pattern.compile("(?i)\\brisposta\\s+(?:a\\s+interpello\\s+)?(?:n\\.?\\s*)?(\\d+)"), "Interpello %s", true),
            new ReferencePattern(Pattern.compile("(?i)\\b(?:d\\.\\s?lgs\\.?|decreto\\s+legislativo)\\s*(?:n\\.?\\s*)?(\\d+\\s*/\\s*\\d{2,4})"), "D.Lgs. %s", false),
            new ReferencePattern(Pattern.compile("(?i)\\b(?:d\\.p\\.r\\.?|dpr)\\s*(?:n\\.?\\s*)?(\\d+\\s*/\\s*\\d{2,4})"), "DPR %s", false),
            new ReferencePattern(Pattern.compile("(?i)\\b(?:legge|l\\.)\\s*(?:n\\.?\\s*)?(\\d+\\s*/\\s*\\d{2,4})"), "Legge %s", false));

    public DocumentMetadataRecord extract(SourceDocument document, double hierarchyWeight) {
        String content = document.content();
        return new DocumentMetadataRecord(hierarchyWeight, keyTopics(content), keyValues(content), referenceCode(document));
    }

    List<String> keyValues(String content) {
        List<String> values = ValueExtractor.all(content);
        return values.size() > MAX_VALUES ? values.subList(0, MAX_VALUES) : values;
    }

    List<String> keyTopics(String content) {
        Set<String> topics = new LinkedHashSet<>();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String lower = content.toLowerCase(Locale.ITALIAN);
        for (String term : FISCAL_TERMS) {
            if (Pattern.compile("\\b" + Pattern.quote(term) + "\\b").matcher(lower).find()) {
                topics.add(term);
            }
        }
        Map<String, Integer> frequencies = new HashMap<>();
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            String word = matcher.group();
            if (!StopWords.ITALIAN.contains(word)) {
                frequencies.merge(word, 1, Integer::sum);
            }
        }
        frequencies.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(FREQUENT_TERMS)
                .forEach(e -> topics.add(e.getKey()));
        List<String> result = new ArrayList<>(topics);
        return result.size() > MAX_TOPICS ? result.subList(0, MAX_TOPICS) : result;
    }

    /**
     * Formatted citation: explicit {@code reference} metadata, else parsed from the
     * title or the opening of the text, else the source name.
     */
    String referenceCode(SourceDocument document) {
        Object explicit = document.metadata().get(SourceDocument.REFERENCE_KEY);
        if (explicit != null && !explicit.toString().isBlank()) {
            return explicit.toString().trim();
        }
        String head = document.content().length() > 400 ? document.content().substring(0, 400) : document.content();
        for (String candidate : new String[]{document.sourceName(), head}) {
            if (candidate == null) {
                continue;
            }
            for (ReferencePattern pattern : REFERENCE_PATTERNS) {
                Matcher matcher = pattern.pattern().matcher(candidate);
                if (matcher.find()) {
                    String code = String.format(pattern.format(), matcher.group(1).replaceAll("\\s+", "").toUpperCase(Locale.ROOT));
                    if (pattern.appendYear() && document.publishedDate() != null) {
                        code = code + "/" + document.publishedDate().getYear();
                    }
                    return code;
                }
            }
        }
        return document.sourceName() != null && !document.sourceName().isBlank() ? document.sourceName() : document.id();
    }

    private record ReferencePattern(Pattern pattern, String format, boolean appendYear) {
    }
}
