package com.jreinhal.norma.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.SourceHierarchy;
import com.jreinhal.norma.rag.fusion.SourceType;
import com.jreinhal.norma.util.EvidenceFormatter;
import com.jreinhal.norma.util.LogSanitizer;
import com.jreinhal.norma.util.ModelJsonParser;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Total parser for the synthesis output. Accepts the JSON payload, the tag format used by
 * streaming ({@code <answer>}, {@code <suggested_actions>}, {@code <structured_question>}),
 * and otherwise takes the raw text as the answer. Never throws.
 */
@Component
public class SynthesisResponseParser {
    private static final Logger log = LoggerFactory.getLogger(SynthesisResponseParser.class);
    static final int MAX_ACTIONS = 4;

    private static final Pattern ANSWER_TAG = Pattern.compile("<answer>(.*?)(?:</answer>|$)", Pattern.DOTALL);
    private static final Pattern ACTIONS_TAG = Pattern.compile("<suggested_actions>(.*?)</suggested_actions>", Pattern.DOTALL);
    private static final Pattern QUESTION_TAG = Pattern.compile("<structured_question>(.*?)</structured_question>", Pattern.DOTALL);
    private static final Pattern REASONING_TAG = Pattern.compile("<reasoning>(.*?)</reasoning>", Pattern.DOTALL);
    private static final Pattern ANY_TAG_BLOCK = Pattern.compile(
            "<(suggested_actions|structured_question|reasoning)>.*?</\\1>", Pattern.DOTALL);
    private static final Pattern CITATION_MARKER = Pattern.compile("\\[(\\d{1,2})]");

    private final SourceHierarchy sourceHierarchy;

    public SynthesisResponseParser(SourceHierarchy sourceHierarchy) {
        this.sourceHierarchy = sourceHierarchy;
    }

    public SynthesisPayload parse(String raw, List<RankedDocument> documents) {
        if (raw == null || raw.isBlank()) {
            log.warn("Synthesis: empty model output");
            return SynthesisPayload.rawText("");
        }
        try {
            if (raw.contains("<answer>") || raw.contains("<suggested_actions>")) {
                return this.parseTags(raw, documents);
            }
            Optional<JsonNode> json = ModelJsonParser.parseObject(raw);
            if (json.isPresent() && json.get().hasNonNull("answer")) {
                return this.parseJson(json.get(), documents);
            }
        } catch (RuntimeException e) {
            log.warn("Synthesis: unexpected payload shape: {}", e.getMessage());
        }
        log.warn("Synthesis: unstructured output, using raw text as answer ({})", LogSanitizer.excerpt(raw, 80));
        return SynthesisPayload.rawText(raw);
    }

    private SynthesisPayload parseJson(JsonNode node, List<RankedDocument> documents) {
        String answer = ModelJsonParser.text(node, "answer", "");
        String reasoning = reasoningSummary(node.get("reasoning"));
        List<CitedSource> sources = new ArrayList<>();
        JsonNode cited = node.has("sources_cited") ? node.get("sources_cited") : node.get("sources");
        if (cited != null && cited.isArray()) {
            for (JsonNode item : cited) {
                if (item.isTextual()) {
                    this.add(sources, item.asText(), null, documents);
                } else if (item.isObject()) {
                    String reference = ModelJsonParser.text(item, "reference", ModelJsonParser.text(item, "id", null));
                    Double relevance = item.has("relevance") ? ModelJsonParser.number(item, "relevance", 0.0) : null;
                    this.add(sources, reference, relevance, documents);
                }
            }
        }
        if (sources.isEmpty()) {
            this.addMarkers(sources, answer, documents);
        }
        JsonNode actionsNode = node.has("suggested_actions") ? node.get("suggested_actions") : node.get("actions");
        JsonNode question = node.get("structured_question");
        return new SynthesisPayload(answer, reasoning, this.order(sources), parseActions(actionsNode),
                question != null && question.isObject() ? question : null, true);
    }

    private SynthesisPayload parseTags(String raw, List<RankedDocument> documents) {
        Matcher answerMatcher = ANSWER_TAG.matcher(raw);
        String answer = answerMatcher.find()
                ? answerMatcher.group(1)
                : ANY_TAG_BLOCK.matcher(raw).replaceAll("");
        answer = answer.replace("</answer>", "").trim();
        List<CandidateAction> actions = List.of();
        Matcher actionsMatcher = ACTIONS_TAG.matcher(raw);
        if (actionsMatcher.find()) {
            actions = parseActions(ModelJsonParser.parseArray(actionsMatcher.group(1)).orElse(null));
        }
        JsonNode question = null;
        Matcher questionMatcher = QUESTION_TAG.matcher(raw);
        if (questionMatcher.find()) {
            question = ModelJsonParser.parseObject(questionMatcher.group(1)).orElse(null);
        }
        Matcher reasoningMatcher = REASONING_TAG.matcher(raw);
        String reasoning = reasoningMatcher.find() ? reasoningMatcher.group(1).trim() : null;
        List<CitedSource> sources = new ArrayList<>();
        this.addMarkers(sources, answer, documents);
        return new SynthesisPayload(answer, reasoning, this.order(sources), actions, question, true);
    }

    static List<CandidateAction> parseActions(JsonNode array) {
        List<CandidateAction> actions = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return actions;
        }
        for (JsonNode item : array) {
            if (!item.isObject() || actions.size() >= MAX_ACTIONS) {
                continue;
            }
            String id = ModelJsonParser.text(item, "id", "a" + (actions.size() + 1));
            actions.add(new CandidateAction(id, ModelJsonParser.text(item, "label", ""),
                    ModelJsonParser.text(item, "icon", null), ModelJsonParser.text(item, "prompt", ""),
                    ModelJsonParser.text(item, "source_basis", ModelJsonParser.text(item, "source", null))));
        }
        return actions;
    }

    static String reasoningSummary(JsonNode reasoning) {
        if (reasoning == null || reasoning.isNull()) {
            return null;
        }
        if (reasoning.isTextual()) {
            return reasoning.asText().trim();
        }
        if (reasoning.isObject()) {
            for (String field : List.of("summary", "conclusion", "conclusione", "theme")) {
                String value = ModelJsonParser.text(reasoning, field, null);
                if (value != null) {
                    return value;
                }
            }
        }
        return reasoning.toString();
    }

    private void addMarkers(List<CitedSource> sources, String answer, List<RankedDocument> documents) {
        Set<String> markers = new LinkedHashSet<>();
        Matcher matcher = CITATION_MARKER.matcher(answer == null ? "" : answer);
        while (matcher.find()) {
            markers.add(matcher.group());
        }
        for (String marker : markers) {
            this.add(sources, marker, null, documents);
        }
    }

    private void add(List<CitedSource> sources, String citation, Double relevance, List<RankedDocument> documents) {
        if (citation == null || citation.isBlank()) {
            return;
        }
        Optional<RankedDocument> match = EvidenceFormatter.resolve(citation, documents);
        CitedSource source;
        if (match.isPresent()) {
            RankedDocument doc = match.get();
            if (sources.stream().anyMatch(s -> doc.id().equals(s.documentId()))) {
                return;
            }
            double relevanceValue = relevance != null ? relevance : relativeScore(doc, documents);
            source = new CitedSource(doc.reference(), doc.id(), doc.sourceType(),
                    this.sourceHierarchy.rank(doc.sourceType()), relevanceValue, doc.publishedDate());
        } else {
            if (citation.matches("\\s*\\[\\d{1,2}]\\s*")) {
                return;
            }
            SourceType type = SourceType.infer(citation);
            source = new CitedSource(citation.trim(), null, type, this.sourceHierarchy.rank(type),
                    relevance != null ? relevance : 0.0, null);
        }
        sources.add(source);
    }

    private static double relativeScore(RankedDocument doc, List<RankedDocument> documents) {
        double top = documents.isEmpty() ? 0.0 : documents.get(0).fusedScore();
        return top <= 0.0 ? 0.0 : Math.min(1.0, doc.fusedScore() / top);
    }

    /**
     * Hierarchy rank first, then newer publication, then relevance.
     */
    List<CitedSource> order(List<CitedSource> sources) {
        List<CitedSource> ordered = new ArrayList<>(sources);
        ordered.sort(Comparator.comparingInt(CitedSource::hierarchyRank)
                .thenComparing(CitedSource::publishedDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
                .thenComparing(Comparator.comparingDouble(CitedSource::relevance).reversed()));
        return ordered;
    }
}
