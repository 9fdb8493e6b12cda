package com.jreinhal.norma.synthesis;

/**
 * A follow-up the user can trigger: {@code label} is shown, {@code prompt} is sent as the
 * next question.
 */
public record CandidateAction(String id, String label, String icon, String prompt, String sourceBasis) {

    public CandidateAction withLabel(String newLabel) {
        return new CandidateAction(this.id, newLabel, this.icon, this.prompt, this.sourceBasis);
    }

    public CandidateAction withIcon(String newIcon) {
        return new CandidateAction(this.id, this.label, newIcon, this.prompt, this.sourceBasis);
    }
}
