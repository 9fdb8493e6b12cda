package com.jreinhal.norma.rag.fusion;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SourceHierarchyTest {

    @Test
    void defaultsMatchSourceTypes() {
        SourceHierarchy hierarchy = SourceHierarchy.defaults();

        assertThat(hierarchy.weight(SourceType.LAW)).isEqualTo(1.3);
        assertThat(hierarchy.weight(SourceType.GUIDE)).isEqualTo(0.95);
        assertThat(hierarchy.weight(null)).isEqualTo(1.0);
        assertThat(hierarchy.rank(SourceType.CIRCULAR)).isEqualTo(3);
    }

    @Test
    void appliesValidOverridesAndIgnoresInvalidOnes() {
        SourceHierarchyProperties properties = new SourceHierarchyProperties();
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("circolare", 1.2);
        weights.put("LAW", 5.0);
        weights.put("sentenza", 1.1);
        weights.put("faq", -0.1);
        properties.setWeights(weights);
        SourceHierarchy hierarchy = new SourceHierarchy(properties);

        hierarchy.init();

        assertThat(hierarchy.weight(SourceType.CIRCULAR)).isEqualTo(1.2);
        assertThat(hierarchy.weight(SourceType.LAW)).isEqualTo(1.3);
        assertThat(hierarchy.weight(SourceType.FAQ)).isEqualTo(1.0);
    }
}
