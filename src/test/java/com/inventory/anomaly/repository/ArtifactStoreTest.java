package com.inventory.anomaly.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inventory.anomaly.model.AnomalyRecord;
import com.inventory.anomaly.model.Severity;
import com.inventory.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactStoreTest {

    @TempDir
    Path dir;

    private final ArtifactStore store = new ArtifactStore();

    @Test
    void writeCsv_headerFollowsDeclaredColumnOrder() throws Exception {
        Path file = dir.resolve("nested/deeper/anomalies.csv");

        String location = store.writeCsv(file, List.of(TestDataFactory.anomaly("P1", 0.91234, Severity.CRITICAL)),
                AnomalyRecord.class);

        assertThat(location).isEqualTo(file.toString());
        List<String> lines = Files.readAllLines(file);
        assertThat(lines).containsExactly(
                "product_id,date,consumption,stock,anomaly_score,is_anomaly,severity",
                "P1,2024-01-01,120.0,40.0,0.91234,true,CRITICAL");
    }

    @Test
    void writeCsv_emptyList_headerOnly() throws Exception {
        Path file = dir.resolve("anomalies_only.csv");

        store.writeCsv(file, List.of(), AnomalyRecord.class);

        assertThat(Files.readAllLines(file))
                .containsExactly("product_id,date,consumption,stock,anomaly_score,is_anomaly,severity");
    }

    @Test
    void writeGzipJson_readableBack() throws Exception {
        Path file = dir.resolve("models/model.json.gz");

        store.writeGzipJson(file, Map.of("seed", 42));

        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            JsonNode node = new ObjectMapper().readTree(in);
            assertThat(node.get("seed").asInt()).isEqualTo(42);
        }
    }

    @Test
    void writeText_replacesExistingFile() throws Exception {
        Path file = dir.resolve("report.html");
        store.writeText(file, "first");

        store.writeText(file, "second");

        assertThat(Files.readString(file)).isEqualTo("second");
    }
}
