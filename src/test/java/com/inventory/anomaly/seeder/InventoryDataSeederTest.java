package com.inventory.anomaly.seeder;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.model.InventoryRecord;
import com.inventory.anomaly.repository.ArtifactStore;
import com.inventory.anomaly.service.InventoryDataLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryDataSeederTest {

    @TempDir
    Path tempDir;

    private PipelineConfig config;
    private InventoryDataSeeder seeder;
    private Path input;

    @BeforeEach
    void setUp() {
        input = tempDir.resolve("data").resolve("inventory_data.csv");
        config = new PipelineConfig();
        config.setInputSource(input.toString());
        config.getSeed().setProducts(3);
        config.getSeed().setStartDate("2024-01-01");
        config.getSeed().setEndDate("2024-03-31");
        seeder = new InventoryDataSeeder(config, new ArtifactStore());
    }

    @Test
    void seedIfMissing_writesFileThePipelineCanLoad() throws Exception {
        assertThat(seeder.seedIfMissing()).isTrue();
        assertThat(input).exists();

        List<InventoryRecord> loaded = new InventoryDataLoader(config).load(input.toString());

        // 3 products x 91 days (2024 is a leap year)
        assertThat(loaded).hasSize(273);
        assertThat(loaded.stream().map(InventoryRecord::getProductId).collect(Collectors.toSet()))
                .containsExactlyInAnyOrder("PROD_001", "PROD_002", "PROD_003");
        assertThat(loaded.get(0).getDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(loaded).allMatch(r -> r.getStock() >= 0 && r.getConsumption() >= 0);
    }

    @Test
    void seedIfMissing_existingInput_leftUntouched() throws Exception {
        Files.createDirectories(input.getParent());
        Files.writeString(input, "date,product_id,stock,consumption\n");

        assertThat(seeder.seedIfMissing()).isFalse();
        assertThat(Files.readString(input)).isEqualTo("date,product_id,stock,consumption\n");
    }

    @Test
    void generate_sameRandomSeed_sameRows() {
        List<InventoryRecord> first = seeder.generate();
        List<InventoryRecord> second = new InventoryDataSeeder(config, new ArtifactStore()).generate();

        assertThat(first).isEqualTo(second);
    }

    @Test
    void generate_fullAnomalyRate_injectsSpikes() {
        config.getSeed().setProducts(1);
        config.getSeed().setAnomalyRate(0.0);
        List<InventoryRecord> calm = seeder.generate();
        double calmMax = calm.stream().mapToDouble(InventoryRecord::getConsumption).max().orElseThrow();

        config.getSeed().setAnomalyRate(1.0);
        List<InventoryRecord> noisy = seeder.generate();
        double noisyMax = noisy.stream().mapToDouble(InventoryRecord::getConsumption).max().orElseThrow();

        // base consumption is at most 50 and the seasonal factors add at most ~1.6x
        assertThat(calmMax).isLessThan(50 * 1.1 * 1.2 * 1.15 * 1.15);
        assertThat(noisyMax).isGreaterThan(calmMax);
    }

    @Test
    void generate_endBeforeStart_rejected() {
        config.getSeed().setEndDate("2023-12-31");

        assertThatThrownBy(() -> seeder.generate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("end-date");
    }
}
