package com.jreinhal.norma.golden;

import com.jreinhal.norma.synthesis.CandidateAction;
import java.util.List;

/**
 * Verdict on one action. {@code modifiedAction} is set when the validator fixed the action
 * (truncated label, normalized icon); it is what should be surfaced.
 */
public record ValidationResult(CandidateAction original, boolean valid, String rejectionReason,
                               CandidateAction modifiedAction, List<String> warnings) {

    public ValidationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationResult rejected(CandidateAction action, String reason) {
        return new ValidationResult(action, false, reason, null, List.of());
    }

    public CandidateAction effectiveAction() {
        return this.modifiedAction != null ? this.modifiedAction : this.original;
    }
}
