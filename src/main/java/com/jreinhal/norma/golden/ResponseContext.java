package com.jreinhal.norma.golden;

import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.synthesis.CitedSource;
import com.jreinhal.norma.synthesis.SynthesisResult;
import com.jreinhal.norma.util.EvidenceFormatter;
import com.jreinhal.norma.util.ValueExtractor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Grounding material for action validation and regeneration: what the answer says and
 * which source it leans on most.
 */
public record ResponseContext(String query, String answerText, String primarySource, String primaryExcerpt,
                              List<String> extractedValues, String mainTopic, List<String> groundingTerms) {
    static final int EXCERPT_CHARS = 400;

    public ResponseContext {
        extractedValues = extractedValues == null ? List.of() : List.copyOf(extractedValues);
        groundingTerms = groundingTerms == null ? List.of() : List.copyOf(groundingTerms);
    }

    public static ResponseContext from(String query, SynthesisResult synthesis, List<RankedDocument> retrieved) {
        List<RankedDocument> documents = retrieved == null ? List.of() : retrieved;
        String answer = synthesis == null || synthesis.answerText() == null ? "" : synthesis.answerText();
        List<CitedSource> cited = synthesis == null ? List.of() : synthesis.sourcesCited();
        RankedDocument primaryDocument = null;
        String primarySource = null;
        if (!cited.isEmpty()) {
            CitedSource first = cited.get(0);
            primarySource = first.reference();
            primaryDocument = documents.stream().filter(d -> d.id().equals(first.documentId())).findFirst().orElse(null);
        } else if (!documents.isEmpty()) {
            primaryDocument = documents.get(0);
            primarySource = primaryDocument.reference();
        }
        String excerpt = primaryDocument == null ? null : EvidenceFormatter.truncate(primaryDocument.content(), EXCERPT_CHARS);

        Set<String> values = new LinkedHashSet<>(ValueExtractor.all(answer));
        Set<String> topics = new LinkedHashSet<>();
        if (primaryDocument != null && primaryDocument.metadataRecord() != null) {
            values.addAll(primaryDocument.metadataRecord().keyValues());
            topics.addAll(primaryDocument.metadataRecord().keyTopics());
        }
        List<String> grounding = new ArrayList<>(topics);
        grounding.addAll(values);
        if (primarySource != null) {
            grounding.add(primarySource);
        }
        for (CitedSource source : cited) {
            if (!grounding.contains(source.reference())) {
                grounding.add(source.reference());
            }
        }
        String mainTopic = topics.isEmpty() ? null : topics.iterator().next();
        return new ResponseContext(query, answer, primarySource, excerpt, new ArrayList<>(values), mainTopic, grounding);
    }

    public Optional<String> topic() {
        return Optional.ofNullable(this.mainTopic);
    }
}
