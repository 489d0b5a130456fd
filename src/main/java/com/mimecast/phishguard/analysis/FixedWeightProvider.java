package com.mimecast.phishguard.analysis;

import java.util.EnumMap;
import java.util.Map;

/**
 * Hand tuned weights.
 *
 * <p>The base score of 0.30 biases towards legitimate.
 */
public class FixedWeightProvider implements WeightProvider {

    /**
     * Prior score before any signal.
     */
    public static final double BASE_SCORE = 0.3;

    private static final FeatureWeights WEIGHTS;

    static {
        Map<Signal, Double> map = new EnumMap<>(Signal.class);
        map.put(Signal.SUSPICIOUS_KEYWORDS, 0.15);
        map.put(Signal.URL_COUNT, 0.12);
        map.put(Signal.SUSPICIOUS_DOMAINS, 0.20);
        map.put(Signal.EXCLAMATION, 0.05);
        map.put(Signal.UPPERCASE_RATIO, 0.08);
        map.put(Signal.HTML_RATIO, 0.06);
        map.put(Signal.LINK_MISMATCH, 0.15);
        map.put(Signal.SUSPICIOUS_FROM, 0.12);
        map.put(Signal.REPLY_DIFFERENT, 0.10);
        map.put(Signal.URGENCY, 0.10);
        map.put(Signal.SPELLING, 0.05);
        map.put(Signal.TRUST_KEYWORDS, -0.08);
        WEIGHTS = new FeatureWeights(BASE_SCORE, map);
    }

    @Override
    public FeatureWeights getWeights() {
        return WEIGHTS;
    }
}
