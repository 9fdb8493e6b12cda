package com.jreinhal.norma.rag.fusion;

import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Vector backend over whatever Spring AI {@link VectorStore} the host application provides.
 * Reports itself unavailable when there is none.
 */
@Component
public class VectorStoreSearchProvider implements SearchProvider {
    private final ObjectProvider<VectorStore> vectorStore;

    @Value("${norma.fusion.vector.similarity-threshold:0.25}")
    private double similarityThreshold;

    public VectorStoreSearchProvider(ObjectProvider<VectorStore> vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public SearchBackend backend() {
        return SearchBackend.VECTOR;
    }

    @Override
    public boolean isAvailable() {
        return this.vectorStore.getIfAvailable() != null;
    }

    @Override
    public List<SourceDocument> search(String query, int limit) {
        VectorStore store = this.vectorStore.getIfAvailable();
        if (store == null) {
            return List.of();
        }
        List<Document> documents = store.similaritySearch(SearchRequest.builder()
                .query(query)
                .topK(limit)
                .similarityThreshold(this.similarityThreshold)
                .build());
        List<SourceDocument> hits = new ArrayList<>();
        if (documents == null) {
            return hits;
        }
        for (Document document : documents) {
            hits.add(SourceDocument.fromMetadata(document.getId(), document.getText(), document.getMetadata(), document.getScore()));
        }
        return hits;
    }
}
