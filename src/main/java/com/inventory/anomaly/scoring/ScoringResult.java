package com.inventory.anomaly.scoring;

import com.inventory.anomaly.engine.isolationforest.IsolationForest;
import lombok.Value;

/**
 * Row-aligned scores and flags for one fitted model.
 */
@Value
public class ScoringResult {
    double[] scores;
    boolean[] flagged;

    // Lowest score that was flagged; +Infinity when nothing was
    double threshold;

    IsolationForest model;

    public int flaggedCount() {
        int count = 0;
        for (boolean f : flagged) {
            if (f) count++;
        }
        return count;
    }
}
