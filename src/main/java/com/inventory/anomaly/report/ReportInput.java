package com.inventory.anomaly.report;

import com.inventory.anomaly.model.AnomalyRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReportInput {
    String runId;
    Instant generatedAt;
    List<AnomalyRecord> records;
    int modelsTrained;
    List<String> forecastFailures;
}
