package com.jreinhal.norma.reasoning;

import java.util.List;

/**
 * One candidate reasoning path. {@code score = confidence × sourceWeightScore}.
 */
public record Hypothesis(String id, String path, String conclusion, double confidence, List<String> sourcesCited,
                         double sourceWeightScore, double score, RiskLevel riskLevel, List<String> riskFactors,
                         String domain) {

    public Hypothesis {
        sourcesCited = sourcesCited == null ? List.of() : List.copyOf(sourcesCited);
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        riskLevel = riskLevel == null ? RiskLevel.LOW : riskLevel;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public Hypothesis withScoring(double sourceWeightScore, double score) {
        return new Hypothesis(this.id, this.path, this.conclusion, this.confidence, this.sourcesCited, sourceWeightScore,
                score, this.riskLevel, this.riskFactors, this.domain);
    }

    public Hypothesis withRisk(RiskLevel level, List<String> factors) {
        return new Hypothesis(this.id, this.path, this.conclusion, this.confidence, this.sourcesCited,
                this.sourceWeightScore, this.score, level, factors, this.domain);
    }
}
