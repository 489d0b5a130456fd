package com.mimecast.phishguard.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable weight table for the linear scorer.
 *
 * <p>Signals missing from the table weigh zero.
 */
public class FeatureWeights {
    private final double baseScore;
    private final Map<Signal, Double> weights;

    /**
     * Constructs a new FeatureWeights instance.
     *
     * @param baseScore Prior score before any signal.
     * @param weights   Weight per signal.
     */
    public FeatureWeights(double baseScore, Map<Signal, Double> weights) {
        this.baseScore = baseScore;
        Map<Signal, Double> copy = new EnumMap<>(Signal.class);
        copy.putAll(weights);
        this.weights = Collections.unmodifiableMap(copy);
    }

    public double getBaseScore() {
        return baseScore;
    }

    /**
     * Gets the weight of a signal.
     *
     * @param signal Signal.
     * @return Weight, 0 if not set.
     */
    public double get(Signal signal) {
        return weights.getOrDefault(signal, 0.0);
    }
}
