package com.inventory.anomaly.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Client and policies for the run-history store.
 */
@Configuration
public class AerospikeConfig {

    public static final String SET_PIPELINE_RUNS = "pipeline_runs";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:inventory}")
    private String namespace;

    @Value("${aerospike.history-retention:90d}")
    private Duration historyRetention;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 20;
        clientPolicy.timeout = 5000;
        // the pipeline still runs when the history store is down
        clientPolicy.failIfNotConnected = false;
        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy runHistoryWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 2000;
        policy.socketTimeout = 1000;
        policy.sendKey = true;
        policy.recordExistsAction = RecordExistsAction.REPLACE;
        policy.expiration = (int) historyRetention.toSeconds();
        return policy;
    }

    @Bean
    public Policy runHistoryReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 2000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public ScanPolicy runHistoryScanPolicy() {
        ScanPolicy policy = new ScanPolicy();
        policy.concurrentNodes = true;
        policy.includeBinData = true;
        policy.totalTimeout = 10000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
