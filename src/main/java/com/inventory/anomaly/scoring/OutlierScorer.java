package com.inventory.anomaly.scoring;

/**
 * Fits an unsupervised outlier model to a feature matrix and scores every row of it.
 * Implementations must be deterministic for a fixed configuration.
 */
public interface OutlierScorer {

    ScoringResult fitScore(double[][] features);
}
