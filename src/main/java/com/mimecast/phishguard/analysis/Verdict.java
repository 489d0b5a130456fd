package com.mimecast.phishguard.analysis;

import com.google.gson.annotations.SerializedName;

/**
 * Binary classification outcome.
 */
public enum Verdict {
    @SerializedName("phishing")
    PHISHING("phishing"),

    @SerializedName("legitimate")
    LEGITIMATE("legitimate");

    /**
     * Score at or above which a message is phishing.
     */
    public static final double THRESHOLD = 0.5;

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    /**
     * Classifies a score.
     *
     * @param score Score in [0, 1].
     * @return Verdict.
     */
    public static Verdict of(double score) {
        return score >= THRESHOLD ? PHISHING : LEGITIMATE;
    }

    @Override
    public String toString() {
        return label;
    }
}
