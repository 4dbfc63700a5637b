package com.inventory.anomaly.scoring;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.engine.isolationforest.IsolationForest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Isolation Forest scorer. Flags the top {@code contamination} share of rows by
 * score (rounded up), ties resolved by row order, so the flagged count does not
 * depend on where a score threshold happens to fall.
 */
@Component
public class IsolationForestScorer implements OutlierScorer {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestScorer.class);

    private final PipelineConfig.IsolationForestSettings settings;

    public IsolationForestScorer(PipelineConfig pipelineConfig) {
        this.settings = pipelineConfig.getIsolationForest();
    }

    @Override
    public ScoringResult fitScore(double[][] features) {
        IsolationForest forest = IsolationForest.fit(features,
                settings.getNumTrees(), settings.getSampleSize(), settings.getSeed());
        double[] scores = forest.scoreAll(features);

        int toFlag = flaggedCount(features.length, settings.getContamination());
        Integer[] ranking = IntStream.range(0, scores.length).boxed().toArray(Integer[]::new);
        Arrays.sort(ranking, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        boolean[] flagged = new boolean[scores.length];
        double threshold = Double.POSITIVE_INFINITY;
        for (int r = 0; r < toFlag; r++) {
            flagged[ranking[r]] = true;
            threshold = scores[ranking[r]];
        }

        log.info("Isolation forest fitted: rows={}, trees={}, flagged={}, threshold={}",
                features.length, forest.getTrees().size(), toFlag, threshold);
        return new ScoringResult(scores, flagged, threshold, forest);
    }

    static int flaggedCount(int rows, double contamination) {
        if (contamination <= 0.0) return 0;
        // Small epsilon so 0.1 * 30 rounds to 3, not 4
        int count = (int) Math.ceil(contamination * rows - 1e-9);
        return Math.min(count, rows);
    }
}
