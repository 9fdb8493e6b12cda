package com.jreinhal.norma.golden;

import com.jreinhal.norma.synthesis.CandidateAction;
import java.util.List;

/**
 * {@code qualityScore} is valid over total, 0 for an empty batch.
 */
public record BatchValidationResult(List<CandidateAction> validatedActions, int rejectedCount, List<String> rejectionLog,
                                    double qualityScore, List<ValidationResult> results) {

    public BatchValidationResult {
        validatedActions = validatedActions == null ? List.of() : List.copyOf(validatedActions);
        rejectionLog = rejectionLog == null ? List.of() : List.copyOf(rejectionLog);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int validCount() {
        return this.validatedActions.size();
    }
}
