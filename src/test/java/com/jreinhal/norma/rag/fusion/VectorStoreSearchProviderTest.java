package com.jreinhal.norma.rag.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

class VectorStoreSearchProviderTest {

    private ObjectProvider<VectorStore> objectProvider;
    private VectorStoreSearchProvider provider;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        objectProvider = mock(ObjectProvider.class);
        provider = new VectorStoreSearchProvider(objectProvider);
        ReflectionTestUtils.setField(provider, "similarityThreshold", 0.25);
    }

    @Test
    void unavailableWithoutVectorStore() {
        when(objectProvider.getIfAvailable()).thenReturn(null);

        assertThat(provider.isAvailable()).isFalse();
        assertThat(provider.search("iva", 5)).isEmpty();
    }

    @Test
    void mapsDocumentsToSourceHits() {
        VectorStore store = mock(VectorStore.class);
        when(objectProvider.getIfAvailable()).thenReturn(store);
        Document document = Document.builder()
                .id("circ-18")
                .text("Chiarimenti sul regime forfettario")
                .metadata(Map.of("source_type", "circolare", "title", "Circolare 18/E", "published_date", "2024-05-01"))
                .score(0.87)
                .build();
        when(store.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(document));

        List<SourceDocument> hits = provider.search("regime forfettario", 7);

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).sourceType()).isEqualTo(SourceType.CIRCULAR);
        assertThat(hits.get(0).sourceName()).isEqualTo("Circolare 18/E");
        assertThat(hits.get(0).publishedDate()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(hits.get(0).score()).isEqualTo(0.87);
        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(store).similaritySearch(request.capture());
        assertThat(request.getValue().getTopK()).isEqualTo(7);
        assertThat(request.getValue().getQuery()).isEqualTo("regime forfettario");
    }
}
