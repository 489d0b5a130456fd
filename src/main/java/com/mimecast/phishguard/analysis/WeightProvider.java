package com.mimecast.phishguard.analysis;

/**
 * Source of scoring weights.
 *
 * <p>Allows a trained weight table to replace the fixed one without touching feature extraction.
 */
public interface WeightProvider {

    /**
     * Gets the weight table.
     *
     * @return FeatureWeights instance.
     */
    FeatureWeights getWeights();
}
