package com.jreinhal.norma.reasoning;

import java.util.List;

/**
 * Jargon-free explanation of the reasoning, safe to show to the user as is. Nullable
 * fields are omitted from the display when absent.
 */
public record PublicReasoning(String mainTheme, String selectedScenario, String whySelected, String confidenceLabel,
                              List<String> primarySources, String alternativesNote, String riskWarning) {

    public PublicReasoning {
        primarySources = primarySources == null ? List.of() : List.copyOf(primarySources);
    }
}
