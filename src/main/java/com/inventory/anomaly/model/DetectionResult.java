package com.inventory.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DetectionResult {
    List<AnomalyRecord> records;
    int anomaliesDetected;
    String anomaliesArtifact;
    String anomaliesOnlyArtifact;
    String modelArtifact;

    public List<AnomalyRecord> flagged() {
        return records.stream().filter(AnomalyRecord::isAnomaly).toList();
    }
}
