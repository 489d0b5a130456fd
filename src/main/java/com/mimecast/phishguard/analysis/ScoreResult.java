package com.mimecast.phishguard.analysis;

import java.util.Collections;
import java.util.List;

/**
 * Scoring outcome with supporting evidence.
 */
public class ScoreResult {
    private final double score;
    private final List<String> highlights;
    private final List<Insight> insights;

    /**
     * Constructs a new ScoreResult instance.
     *
     * @param score      Score in [0, 1].
     * @param highlights Evidence sentences in report order.
     * @param insights   Insight records in report order.
     */
    public ScoreResult(double score, List<String> highlights, List<Insight> insights) {
        this.score = score;
        this.highlights = Collections.unmodifiableList(highlights);
        this.insights = Collections.unmodifiableList(insights);
    }

    public double getScore() {
        return score;
    }

    public List<String> getHighlights() {
        return highlights;
    }

    public List<Insight> getInsights() {
        return insights;
    }

    /**
     * Gets verdict derived from the score.
     *
     * @return Verdict.
     */
    public Verdict getVerdict() {
        return Verdict.of(score);
    }

    /**
     * Gets distance from the decision boundary rescaled to [0, 1].
     *
     * @return Confidence.
     */
    public double getConfidence() {
        return Math.min(1.0, Math.abs(score - Verdict.THRESHOLD) * 2);
    }
}
