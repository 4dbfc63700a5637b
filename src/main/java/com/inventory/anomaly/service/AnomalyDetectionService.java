package com.inventory.anomaly.service;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.config.SeverityThresholdConfig.Thresholds;
import com.inventory.anomaly.engine.ValidationException;
import com.inventory.anomaly.model.AnomalyRecord;
import com.inventory.anomaly.model.DailyAggregate;
import com.inventory.anomaly.model.DetectionResult;
import com.inventory.anomaly.model.Severity;
import com.inventory.anomaly.scoring.OutlierScorer;
import com.inventory.anomaly.scoring.ScoringResult;
import com.inventory.anomaly.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores daily aggregates on (mean consumption, mean stock), classifies flagged
 * rows and writes the scored table, the flagged subset and the fitted model.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final String ANOMALIES_FILE = "anomalies_detected.csv";
    static final String ANOMALIES_ONLY_FILE = "anomalies_only.csv";
    static final String MODEL_FILE = "isolation_forest_model.json.gz";

    private final OutlierScorer scorer;
    private final SeverityClassifier classifier;
    private final ArtifactStore artifactStore;
    private final PipelineConfig config;

    public AnomalyDetectionService(OutlierScorer scorer, SeverityClassifier classifier,
                                   ArtifactStore artifactStore, PipelineConfig config) {
        this.scorer = scorer;
        this.classifier = classifier;
        this.artifactStore = artifactStore;
        this.config = config;
    }

    public DetectionResult detect(List<DailyAggregate> aggregates) throws IOException {
        if (aggregates.isEmpty()) {
            throw new ValidationException("No aggregated rows to score");
        }

        double[][] features = new double[aggregates.size()][];
        for (int i = 0; i < aggregates.size(); i++) {
            DailyAggregate a = aggregates.get(i);
            features[i] = new double[]{a.getConsumptionMean(), a.getStockMean()};
        }

        ScoringResult scoring = scorer.fitScore(features);
        Thresholds thresholds = classifier.currentThresholds();

        List<AnomalyRecord> records = new ArrayList<>(aggregates.size());
        List<AnomalyRecord> flagged = new ArrayList<>();
        for (int i = 0; i < aggregates.size(); i++) {
            DailyAggregate a = aggregates.get(i);
            boolean isAnomaly = scoring.getFlagged()[i];
            double score = scoring.getScores()[i];
            AnomalyRecord record = AnomalyRecord.builder()
                    .productId(a.getProductId())
                    .date(a.getDate())
                    .consumption(a.getConsumptionMean())
                    .stock(a.getStockMean())
                    .anomalyScore(score)
                    .anomaly(isAnomaly)
                    .severity(isAnomaly ? classifier.classify(score, thresholds) : Severity.NONE)
                    .build();
            records.add(record);
            if (isAnomaly) flagged.add(record);
        }

        Path outputDir = Path.of(config.getOutputDir());
        String all = artifactStore.writeCsv(outputDir.resolve(ANOMALIES_FILE), records, AnomalyRecord.class);
        String only = artifactStore.writeCsv(outputDir.resolve(ANOMALIES_ONLY_FILE), flagged, AnomalyRecord.class);
        String model = artifactStore.writeGzipJson(Path.of(config.getModelsDir(), MODEL_FILE),
                modelDocument(scoring));

        log.info("Anomalies detected: {} of {} ({}%)", flagged.size(), records.size(),
                String.format("%.2f", records.isEmpty() ? 0.0 : flagged.size() * 100.0 / records.size()));
        return DetectionResult.builder()
                .records(records)
                .anomaliesDetected(flagged.size())
                .anomaliesArtifact(all)
                .anomaliesOnlyArtifact(only)
                .modelArtifact(model)
                .build();
    }

    private Map<String, Object> modelDocument(ScoringResult scoring) {
        PipelineConfig.IsolationForestSettings settings = config.getIsolationForest();
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("features", List.of("consumption_mean", "stock_mean"));
        doc.put("contamination", settings.getContamination());
        doc.put("seed", settings.getSeed());
        doc.put("threshold", Double.isInfinite(scoring.getThreshold()) ? null : scoring.getThreshold());
        doc.put("forest", scoring.getModel());
        return doc;
    }
}
