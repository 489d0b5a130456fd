package com.mimecast.phishguard.analysis;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Analysis response returned to callers.
 *
 * <p>Serialized with Gson using snake_case field names.
 */
public class AnalysisResponse {
    private final Verdict verdict;
    private final double confidence;

    @SerializedName("model_version")
    private final String modelVersion;

    private final EmailMetadata metadata;
    private final List<String> highlights;
    private final List<Insight> insights;

    /**
     * Constructs a new AnalysisResponse instance.
     *
     * @param verdict      Verdict.
     * @param confidence   Confidence in [0, 1].
     * @param modelVersion Model version.
     * @param metadata     Email metadata.
     * @param highlights   Evidence sentences.
     * @param insights     Insight records.
     */
    public AnalysisResponse(Verdict verdict, double confidence, String modelVersion,
                            EmailMetadata metadata, List<String> highlights, List<Insight> insights) {
        this.verdict = verdict;
        this.confidence = confidence;
        this.modelVersion = modelVersion;
        this.metadata = metadata;
        this.highlights = List.copyOf(highlights);
        this.insights = List.copyOf(insights);
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public EmailMetadata getMetadata() {
        return metadata;
    }

    public List<String> getHighlights() {
        return highlights;
    }

    public List<Insight> getInsights() {
        return insights;
    }
}
