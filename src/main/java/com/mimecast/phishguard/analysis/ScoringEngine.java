package com.mimecast.phishguard.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear scorer.
 * <p>
 * Every signal is normalized to [0, 1] with a saturating transform, multiplied by its weight
 * and added to the base score. The total is clamped to [0, 1].
 * <p>
 * Highlights and insights are derived from the features alone. Insight weights are
 * display hints and do not affect the score.
 */
public class ScoringEngine {
    private static final Logger log = LogManager.getLogger(ScoringEngine.class);

    /**
     * URL count above which the message is flagged as link heavy.
     */
    static final int MANY_URLS_THRESHOLD = 3;

    /**
     * Urgency word count above which urgency is flagged.
     */
    static final int URGENCY_THRESHOLD = 2;

    private final WeightProvider weightProvider;
    private final MessageCatalog catalog;

    /**
     * Constructs a new ScoringEngine instance.
     *
     * @param weightProvider Weight provider.
     * @param catalog        Highlight and insight text.
     */
    public ScoringEngine(WeightProvider weightProvider, MessageCatalog catalog) {
        this.weightProvider = weightProvider;
        this.catalog = catalog;
    }

    /**
     * Scores features.
     *
     * @param features EmailFeatures instance.
     * @return ScoreResult instance.
     */
    public ScoreResult score(EmailFeatures features) {
        double score = clamp(rawScore(features));
        log.debug("Scored {}: {}", Verdict.of(score), score);

        return new ScoreResult(score, highlights(features), insights(features));
    }

    /**
     * Computes the unclamped weighted sum.
     *
     * @param features EmailFeatures instance.
     * @return Raw score.
     */
    double rawScore(EmailFeatures features) {
        FeatureWeights weights = weightProvider.getWeights();

        double score = weights.getBaseScore();
        score += saturate(features.getSuspiciousKeywordCount() / 5.0) * weights.get(Signal.SUSPICIOUS_KEYWORDS);
        score += saturate(features.getUrlCount() / 3.0) * weights.get(Signal.URL_COUNT);
        score += saturate(features.getSuspiciousDomainCount() / 2.0) * weights.get(Signal.SUSPICIOUS_DOMAINS);
        score += saturate(features.getExclamationCount() / 5.0) * weights.get(Signal.EXCLAMATION);
        score += saturate(features.getUppercaseRatio() * 2.0) * weights.get(Signal.UPPERCASE_RATIO);
        score += saturate(features.getHtmlRatio() * 10.0) * weights.get(Signal.HTML_RATIO);
        score += flag(features.isLinkTextMismatch()) * weights.get(Signal.LINK_MISMATCH);
        score += flag(features.isFromDomainSuspicious()) * weights.get(Signal.SUSPICIOUS_FROM);
        score += flag(features.isReplyToDifferent()) * weights.get(Signal.REPLY_DIFFERENT);
        score += saturate(features.getUrgencyWords() / 3.0) * weights.get(Signal.URGENCY);
        score += saturate(features.getSpellingErrorsEstimate()) * weights.get(Signal.SPELLING);
        score += saturate(features.getTrustKeywordCount() / 3.0) * weights.get(Signal.TRUST_KEYWORDS);

        return score;
    }

    /**
     * Builds evidence sentences for triggered conditions.
     *
     * @param features EmailFeatures instance.
     * @return Ordered list of sentences.
     */
    private List<String> highlights(EmailFeatures features) {
        List<String> highlights = new ArrayList<>();

        if (features.getSuspiciousKeywordCount() > 0) {
            highlights.add(catalog.highlight(HighlightKind.SUSPICIOUS_KEYWORDS, features.getSuspiciousKeywordCount()));
        }
        if (features.getSuspiciousDomainCount() > 0) {
            highlights.add(catalog.highlight(HighlightKind.SUSPICIOUS_DOMAINS, features.getSuspiciousDomainCount()));
        }
        if (features.getUrlCount() > MANY_URLS_THRESHOLD) {
            highlights.add(catalog.highlight(HighlightKind.MANY_URLS, features.getUrlCount()));
        }
        if (features.isLinkTextMismatch()) {
            highlights.add(catalog.highlight(HighlightKind.LINK_MISMATCH));
        }
        if (features.isFromDomainSuspicious()) {
            highlights.add(catalog.highlight(HighlightKind.FROM_DOMAIN_SUSPICIOUS));
        }
        if (features.isReplyToDifferent()) {
            highlights.add(catalog.highlight(HighlightKind.REPLY_TO_DIFFERENT));
        }
        if (features.getUrgencyWords() > URGENCY_THRESHOLD) {
            highlights.add(catalog.highlight(HighlightKind.EXCESSIVE_URGENCY, features.getUrgencyWords()));
        }
        if (features.getTrustKeywordCount() > 0) {
            highlights.add(catalog.highlight(HighlightKind.TRUST_SIGNALS, features.getTrustKeywordCount()));
        }

        return highlights;
    }

    /**
     * Builds the six insight records.
     *
     * @param features EmailFeatures instance.
     * @return Ordered list of insights.
     */
    private List<Insight> insights(EmailFeatures features) {
        List<Insight> insights = new ArrayList<>();

        insights.add(insight(InsightName.SUSPICIOUS_KEYWORDS, features.getSuspiciousKeywordCount(),
                saturate(features.getSuspiciousKeywordCount() * 0.2)));
        insights.add(insight(InsightName.URL_COUNT, features.getUrlCount(),
                saturate(features.getUrlCount() * 0.15)));
        insights.add(insight(InsightName.SUSPICIOUS_DOMAINS, features.getSuspiciousDomainCount(),
                saturate(features.getSuspiciousDomainCount() * 0.3)));
        insights.add(insight(InsightName.LINK_MISMATCH, features.isLinkTextMismatch() ? 1 : 0,
                features.isLinkTextMismatch() ? 0.15 : 0.0));
        insights.add(insight(InsightName.FROM_DOMAIN_SUSPICIOUS, features.isFromDomainSuspicious() ? 1 : 0,
                features.isFromDomainSuspicious() ? 0.12 : 0.0));
        insights.add(insight(InsightName.TRUST_SIGNALS, features.getTrustKeywordCount(),
                saturate(features.getTrustKeywordCount() * 0.15)));

        return insights;
    }

    private Insight insight(InsightName name, int value, double weight) {
        return new Insight(name, value, weight, catalog.insightDescription(name));
    }

    private static double saturate(double value) {
        return Math.min(1.0, value);
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
