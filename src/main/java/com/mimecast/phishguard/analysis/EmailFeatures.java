package com.mimecast.phishguard.analysis;

/**
 * Immutable set of signals extracted from one message.
 *
 * <p>Counts are never negative and ratios are clamped to [0, 1] on construction.
 *
 * @see FeatureExtractor
 */
public class EmailFeatures {
    private final int suspiciousKeywordCount;
    private final int trustKeywordCount;
    private final int urlCount;
    private final int suspiciousDomainCount;
    private final int exclamationCount;
    private final int questionCount;
    private final double uppercaseRatio;
    private final int bodyLength;
    private final int subjectLength;
    private final boolean hasHtml;
    private final double htmlRatio;
    private final boolean linkTextMismatch;
    private final boolean fromDomainSuspicious;
    private final boolean replyToDifferent;
    private final int urgencyWords;
    private final double spellingErrorsEstimate;

    private EmailFeatures(Builder builder) {
        this.suspiciousKeywordCount = Math.max(0, builder.suspiciousKeywordCount);
        this.trustKeywordCount = Math.max(0, builder.trustKeywordCount);
        this.urlCount = Math.max(0, builder.urlCount);
        this.suspiciousDomainCount = Math.max(0, builder.suspiciousDomainCount);
        this.exclamationCount = Math.max(0, builder.exclamationCount);
        this.questionCount = Math.max(0, builder.questionCount);
        this.uppercaseRatio = clamp(builder.uppercaseRatio);
        this.bodyLength = Math.max(0, builder.bodyLength);
        this.subjectLength = Math.max(0, builder.subjectLength);
        this.hasHtml = builder.hasHtml;
        this.htmlRatio = clamp(builder.htmlRatio);
        this.linkTextMismatch = builder.linkTextMismatch;
        this.fromDomainSuspicious = builder.fromDomainSuspicious;
        this.replyToDifferent = builder.replyToDifferent;
        this.urgencyWords = Math.max(0, builder.urgencyWords);
        this.spellingErrorsEstimate = clamp(builder.spellingErrorsEstimate);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Creates a new builder with every signal at zero.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getSuspiciousKeywordCount() {
        return suspiciousKeywordCount;
    }

    public int getTrustKeywordCount() {
        return trustKeywordCount;
    }

    public int getUrlCount() {
        return urlCount;
    }

    public int getSuspiciousDomainCount() {
        return suspiciousDomainCount;
    }

    public int getExclamationCount() {
        return exclamationCount;
    }

    public int getQuestionCount() {
        return questionCount;
    }

    public double getUppercaseRatio() {
        return uppercaseRatio;
    }

    public int getBodyLength() {
        return bodyLength;
    }

    public int getSubjectLength() {
        return subjectLength;
    }

    public boolean hasHtml() {
        return hasHtml;
    }

    public double getHtmlRatio() {
        return htmlRatio;
    }

    public boolean isLinkTextMismatch() {
        return linkTextMismatch;
    }

    public boolean isFromDomainSuspicious() {
        return fromDomainSuspicious;
    }

    public boolean isReplyToDifferent() {
        return replyToDifferent;
    }

    public int getUrgencyWords() {
        return urgencyWords;
    }

    public double getSpellingErrorsEstimate() {
        return spellingErrorsEstimate;
    }

    @Override
    public String toString() {
        return "EmailFeatures{" +
                "suspiciousKeywordCount=" + suspiciousKeywordCount +
                ", trustKeywordCount=" + trustKeywordCount +
                ", urlCount=" + urlCount +
                ", suspiciousDomainCount=" + suspiciousDomainCount +
                ", exclamationCount=" + exclamationCount +
                ", questionCount=" + questionCount +
                ", uppercaseRatio=" + uppercaseRatio +
                ", bodyLength=" + bodyLength +
                ", subjectLength=" + subjectLength +
                ", hasHtml=" + hasHtml +
                ", htmlRatio=" + htmlRatio +
                ", linkTextMismatch=" + linkTextMismatch +
                ", fromDomainSuspicious=" + fromDomainSuspicious +
                ", replyToDifferent=" + replyToDifferent +
                ", urgencyWords=" + urgencyWords +
                ", spellingErrorsEstimate=" + spellingErrorsEstimate +
                '}';
    }

    /**
     * EmailFeatures builder.
     */
    public static class Builder {
        private int suspiciousKeywordCount;
        private int trustKeywordCount;
        private int urlCount;
        private int suspiciousDomainCount;
        private int exclamationCount;
        private int questionCount;
        private double uppercaseRatio;
        private int bodyLength;
        private int subjectLength;
        private boolean hasHtml;
        private double htmlRatio;
        private boolean linkTextMismatch;
        private boolean fromDomainSuspicious;
        private boolean replyToDifferent;
        private int urgencyWords;
        private double spellingErrorsEstimate;

        public Builder suspiciousKeywordCount(int value) {
            this.suspiciousKeywordCount = value;
            return this;
        }

        public Builder trustKeywordCount(int value) {
            this.trustKeywordCount = value;
            return this;
        }

        public Builder urlCount(int value) {
            this.urlCount = value;
            return this;
        }

        public Builder suspiciousDomainCount(int value) {
            this.suspiciousDomainCount = value;
            return this;
        }

        public Builder exclamationCount(int value) {
            this.exclamationCount = value;
            return this;
        }

        public Builder questionCount(int value) {
            this.questionCount = value;
            return this;
        }

        public Builder uppercaseRatio(double value) {
            this.uppercaseRatio = value;
            return this;
        }

        public Builder bodyLength(int value) {
            this.bodyLength = value;
            return this;
        }

        public Builder subjectLength(int value) {
            this.subjectLength = value;
            return this;
        }

        public Builder hasHtml(boolean value) {
            this.hasHtml = value;
            return this;
        }

        public Builder htmlRatio(double value) {
            this.htmlRatio = value;
            return this;
        }

        public Builder linkTextMismatch(boolean value) {
            this.linkTextMismatch = value;
            return this;
        }

        public Builder fromDomainSuspicious(boolean value) {
            this.fromDomainSuspicious = value;
            return this;
        }

        public Builder replyToDifferent(boolean value) {
            this.replyToDifferent = value;
            return this;
        }

        public Builder urgencyWords(int value) {
            this.urgencyWords = value;
            return this;
        }

        public Builder spellingErrorsEstimate(double value) {
            this.spellingErrorsEstimate = value;
            return this;
        }

        public EmailFeatures build() {
            return new EmailFeatures(this);
        }
    }
}
