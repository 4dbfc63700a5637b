package com.inventory.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inventory.anomaly.config.AerospikeConfig;
import com.inventory.anomaly.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * History of sealed run results, one record per run in the {@code pipeline_runs} set.
 */
@Repository
public class PipelineRunRepository {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ScanPolicy scanPolicy;
    private final ObjectMapper objectMapper;

    public PipelineRunRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("runHistoryWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("runHistoryReadPolicy") Policy readPolicy,
                                 @Qualifier("runHistoryScanPolicy") ScanPolicy scanPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.scanPolicy = scanPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Stores the result. Failures are logged and reported as {@code false};
     * history is never allowed to change the outcome of a run.
     */
    public boolean save(RunResult result) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_PIPELINE_RUNS, result.getRunId());
            client.put(writePolicy, key,
                    new Bin("runId", result.getRunId()),
                    new Bin("status", result.getStatus().toJson()),
                    new Bin("startedAt", result.getStartedAt()),
                    new Bin("resultJson", objectMapper.writeValueAsString(result)));
            return true;
        } catch (Exception e) {
            log.error("Failed to store run history for {}", result.getRunId(), e);
            return false;
        }
    }

    public RunResult findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PIPELINE_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return deserialize(record);
    }

    public List<RunResult> findRecent(int limit) {
        List<RunResult> results = new ArrayList<>();
        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PIPELINE_RUNS,
                (key, record) -> {
                    RunResult result = deserialize(record);
                    if (result != null) {
                        synchronized (results) {
                            results.add(result);
                        }
                    }
                });

        results.sort(Comparator.comparingLong(RunResult::getStartedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private RunResult deserialize(Record record) {
        try {
            return objectMapper.readValue(record.getString("resultJson"), RunResult.class);
        } catch (Exception e) {
            log.warn("Skipping unreadable run record: {}", e.getMessage());
            return null;
        }
    }
}
