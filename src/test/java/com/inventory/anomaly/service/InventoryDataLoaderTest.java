package com.inventory.anomaly.service;

import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.engine.ValidationException;
import com.inventory.anomaly.model.InventoryRecord;
import com.inventory.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryDataLoaderTest {

    @TempDir
    Path dir;

    private PipelineConfig config;
    private InventoryDataLoader loader;

    @BeforeEach
    void setUp() {
        config = new PipelineConfig();
        config.setMinRecords(3);
        loader = new InventoryDataLoader(config);
    }

    @Test
    void load_validFile_sortedByProductThenDate() throws Exception {
        Path file = write("""
                date,product_id,stock,consumption
                2024-01-02,P2,90,11
                2024-01-01,P2,100,10
                2024-01-01,P1,50,5
                """);

        List<InventoryRecord> records = loader.load(file.toString());

        assertThat(records).extracting(InventoryRecord::getProductId).containsExactly("P1", "P2", "P2");
        assertThat(records.get(1).getDate()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(records.get(2).getStock()).isEqualTo(90.0);
        assertThat(records.get(2).getConsumption()).isEqualTo(11.0);
    }

    @Test
    void load_legacyColumnNames_accepted() throws Exception {
        Path file = write("""
                data,produto_id,estoque,consumo
                2024-01-01,P1,50,5
                2024-01-02,P1,45,
                2024-01-03,P1,40,6
                """);

        List<InventoryRecord> records = loader.load(file.toString());

        assertThat(records).hasSize(3);
        assertThat(records.get(0).getProductId()).isEqualTo("P1");
        assertThat(records.get(1).getConsumption()).isNull();
        assertThat(records.get(2).getStock()).isEqualTo(40.0);
    }

    @Test
    void load_generatedFile_allRowsRead() throws Exception {
        Path file = TestDataFactory.writeInventoryCsv(dir, List.of("P1", "P2"), 40);

        assertThat(loader.load(file.toString())).hasSize(80);
    }

    @Test
    void load_tooFewRows_validationFailure() throws Exception {
        Path file = write("date,product_id,stock,consumption\n2024-01-01,P1,50,5\n");

        assertThatThrownBy(() -> loader.load(file.toString()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at least 3");
    }

    @Test
    void load_headerOnly_validationFailure() throws Exception {
        Path file = write("date,product_id,stock,consumption\n");

        assertThatThrownBy(() -> loader.load(file.toString()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("no rows");
    }

    @Test
    void load_missingProductId_reportsLine() throws Exception {
        Path file = write("""
                date,product_id,stock,consumption
                2024-01-01,P1,50,5
                2024-01-02,,45,4
                2024-01-03,P1,40,6
                """);

        assertThatThrownBy(() -> loader.load(file.toString()))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Missing product_id on line 3");
    }

    @Test
    void load_unparseableDate_validationFailure() throws Exception {
        Path file = write("""
                date,product_id,stock,consumption
                2024-01-01,P1,50,5
                yesterday,P1,45,4
                2024-01-03,P1,40,6
                """);

        assertThatThrownBy(() -> loader.load(file.toString()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void load_missingFile_ioErrorPropagates() {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.csv").toString()))
                .isInstanceOf(NoSuchFileException.class);
    }

    private Path write(String content) throws Exception {
        Path file = dir.resolve("inventory.csv");
        Files.writeString(file, content);
        return file;
    }
}
