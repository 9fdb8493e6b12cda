package com.jreinhal.norma.rag.fusion;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentMetadataExtractorTest {

    private final DocumentMetadataExtractor extractor = new DocumentMetadataExtractor();

    @Test
    void formatsCircularReferenceWithYear() {
        SourceDocument document = new SourceDocument("c1", "Chiarimenti sul regime forfettario.", "Circolare n. 18/E del 2024",
                SourceType.CIRCULAR, LocalDate.of(2024, 5, 1), 0.8, Map.of());

        assertThat(extractor.referenceCode(document)).isEqualTo("Circolare 18/E/2024");
    }

    @Test
    void findsDecreeReferenceInText() {
        SourceDocument document = new SourceDocument("d1", "Ai sensi del D.Lgs. 471/1997 la sanzione è pari al 30%.",
                "Nota interna", SourceType.DECREE, null, 0.8, Map.of());

        assertThat(extractor.referenceCode(document)).isEqualTo("D.Lgs. 471/1997");
    }

    @Test
    void explicitReferenceWins() {
        SourceDocument document = new SourceDocument("l1", "Testo", "Titolo", SourceType.LAW, null, 0.8,
                Map.of(SourceDocument.REFERENCE_KEY, "Legge 190/2014, art. 1, c. 54"));

        assertThat(extractor.referenceCode(document)).isEqualTo("Legge 190/2014, art. 1, c. 54");
    }

    @Test
    void extractsTopicsAndValues() {
        SourceDocument document = new SourceDocument("x", "L'aliquota IVA ordinaria è del 22%. L'aliquota ridotta del 10% "
                + "si applica alle prestazioni indicate; la soglia è di 85.000 euro.", "Guida IVA", SourceType.GUIDE, null, 0.5, Map.of());

        DocumentMetadataRecord record = extractor.extract(document, 0.95);

        assertThat(record.keyTopics()).contains("aliquota", "iva");
        assertThat(record.keyValues()).containsExactly("22%", "10%", "85.000 euro");
        assertThat(record.hierarchyWeight()).isEqualTo(0.95);
    }

    @Test
    void fromMetadataInfersTypeFromReference() {
        SourceDocument document = SourceDocument.fromMetadata("r1", "Testo", Map.of(
                SourceDocument.REFERENCE_KEY, "Risoluzione 5/E/2023",
                SourceDocument.PUBLISHED_KEY, "2023-02-10T00:00:00Z"), 0.7);

        assertThat(document.sourceType()).isEqualTo(SourceType.RESOLUTION);
        assertThat(document.sourceName()).isEqualTo("Risoluzione 5/E/2023");
        assertThat(document.publishedDate()).isEqualTo(LocalDate.of(2023, 2, 10));
    }
}
