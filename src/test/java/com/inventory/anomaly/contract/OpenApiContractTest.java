package com.inventory.anomaly.contract;

import com.aerospike.client.AerospikeClient;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published API surface: every endpoint and the run result schema
 * must stay in the generated OpenAPI document.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @MockBean
    private AerospikeClient aerospikeClient;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = apiDocs();
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/pipeline/runs");
        assertThat(paths).containsKey("/api/v1/pipeline/runs/{runId}");
        assertThat(paths).containsKey("/api/v1/config/severity");
        assertThat(paths).containsKey("/api/v1/config/channels");
    }

    @Test
    void openApiSpec_runEndpointsHaveExpectedMethods() {
        DocumentContext json = apiDocs();

        Map<String, Object> runs = json.read("$.paths['/api/v1/pipeline/runs']");
        assertThat(runs).containsKeys("post", "get");

        Map<String, Object> severity = json.read("$.paths['/api/v1/config/severity']");
        assertThat(severity).containsKeys("get", "put");
    }

    @Test
    void openApiSpec_runResultSchemaUsesWireNames() {
        DocumentContext json = apiDocs();
        Map<String, Object> properties = json.read("$.components.schemas.RunResult.properties");

        assertThat(properties).containsKeys("run_id", "total_records", "anomalies_detected",
                "anomaly_percentage", "models_trained", "forecast_failures", "alert_outcomes",
                "report_artifact", "task_states", "status");
    }

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        return JsonPath.parse(response.getBody());
    }
}
