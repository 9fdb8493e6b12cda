package com.jreinhal.norma.golden;

import com.jreinhal.norma.synthesis.CandidateAction;
import java.util.List;

public record GoldenLoopResult(List<CandidateAction> actions, int iterationsUsed, boolean regenerationTriggered,
                               long totalLatencyMs, int finalValidCount, boolean usedFallback,
                               double initialQualityScore) {

    public GoldenLoopResult {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static GoldenLoopResult skipped() {
        return new GoldenLoopResult(List.of(), 0, false, 0L, 0, false, 0.0);
    }
}
