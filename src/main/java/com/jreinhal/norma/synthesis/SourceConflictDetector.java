package com.jreinhal.norma.synthesis;

import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.util.ValueExtractor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flags pairs of cited sources that share a topic but state different percentages or
 * amounts. The higher-ranked source wins (HIERARCHY); at equal rank the more recent one
 * wins (TEMPORAL).
 */
@Component
public class SourceConflictDetector {
    private static final Logger log = LoggerFactory.getLogger(SourceConflictDetector.class);

    public ConflictAnalysis analyze(List<CitedSource> sources, List<RankedDocument> documents) {
        List<SourceConflict> conflicts = this.detect(sources, documents);
        if (conflicts.isEmpty()) {
            return ConflictAnalysis.none();
        }
        log.info("Synthesis: {} source conflict(s) detected", conflicts.size());
        return new ConflictAnalysis(conflicts, summarize(conflicts));
    }

    public List<SourceConflict> detect(List<CitedSource> sources, List<RankedDocument> documents) {
        if (sources == null || sources.size() < 2 || documents == null || documents.isEmpty()) {
            return List.of();
        }
        Map<String, RankedDocument> byId = documents.stream()
                .collect(Collectors.toMap(RankedDocument::id, Function.identity(), (a, b) -> a));
        List<SourceConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < sources.size(); i++) {
            for (int j = i + 1; j < sources.size(); j++) {
                CitedSource a = sources.get(i);
                CitedSource b = sources.get(j);
                RankedDocument docA = a.isResolved() ? byId.get(a.documentId()) : null;
                RankedDocument docB = b.isResolved() ? byId.get(b.documentId()) : null;
                if (docA == null || docB == null || docA.metadataRecord() == null || docB.metadataRecord() == null) {
                    continue;
                }
                Set<String> sharedTopics = new LinkedHashSet<>(docA.metadataRecord().keyTopics());
                sharedTopics.retainAll(docB.metadataRecord().keyTopics());
                if (sharedTopics.isEmpty() || !contradicts(docA, docB)) {
                    continue;
                }
                SourceConflict conflict = resolve(a, b, sharedTopics.iterator().next());
                if (conflict != null) {
                    conflicts.add(conflict);
                }
            }
        }
        return conflicts;
    }

    static boolean contradicts(RankedDocument a, RankedDocument b) {
        Set<String> valuesA = comparableValues(a);
        Set<String> valuesB = comparableValues(b);
        if (valuesA.isEmpty() || valuesB.isEmpty()) {
            return false;
        }
        for (String value : valuesA) {
            if (valuesB.contains(value)) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> comparableValues(RankedDocument doc) {
        Set<String> values = new LinkedHashSet<>();
        for (String value : doc.metadataRecord().keyValues()) {
            if (ValueExtractor.isPercentage(value)) {
                values.add("%" + ValueExtractor.normalize(value));
            } else if (ValueExtractor.isAmount(value)) {
                values.add("€" + ValueExtractor.normalize(value));
            }
        }
        return values;
    }

    private static SourceConflict resolve(CitedSource a, CitedSource b, String topic) {
        if (a.hierarchyRank() != b.hierarchyRank()) {
            CitedSource preferred = a.hierarchyRank() < b.hierarchyRank() ? a : b;
            CitedSource other = preferred == a ? b : a;
            return new SourceConflict(SourceConflict.Type.HIERARCHY, SourceConflict.Severity.HIGH,
                    preferred.reference(), other.reference(), topic,
                    "Prevale " + preferred.reference() + " (" + preferred.sourceType().label()
                            + ") per maggiore rango nella gerarchia delle fonti rispetto a " + other.reference()
                            + " (" + other.sourceType().label() + ").");
        }
        if (a.publishedDate() != null && b.publishedDate() != null && !a.publishedDate().equals(b.publishedDate())) {
            CitedSource preferred = a.publishedDate().isAfter(b.publishedDate()) ? a : b;
            CitedSource other = preferred == a ? b : a;
            return new SourceConflict(SourceConflict.Type.TEMPORAL, SourceConflict.Severity.MEDIUM,
                    preferred.reference(), other.reference(), topic,
                    "Prevale " + preferred.reference() + " in quanto più recente (" + preferred.publishedDate()
                            + ") rispetto a " + other.reference() + " (" + other.publishedDate() + ").");
        }
        log.debug("Synthesis: unresolvable conflict between {} and {}", a.reference(), b.reference());
        return null;
    }

    static String summarize(List<SourceConflict> conflicts) {
        long hierarchy = conflicts.stream().filter(c -> c.type() == SourceConflict.Type.HIERARCHY).count();
        long temporal = conflicts.size() - hierarchy;
        StringBuilder sb = new StringBuilder("Rilevate ").append(conflicts.size())
                .append(conflicts.size() == 1 ? " divergenza" : " divergenze").append(" tra le fonti");
        if (hierarchy > 0 && temporal > 0) {
            sb.append(" (").append(hierarchy).append(" di gerarchia, ").append(temporal).append(" temporali)");
        }
        sb.append(". ").append(conflicts.get(0).resolution());
        return sb.toString();
    }
}
