package com.inventory.anomaly.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.inventory.anomaly.config.PipelineConfig;
import com.inventory.anomaly.engine.ValidationException;
import com.inventory.anomaly.model.InventoryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads the raw inventory CSV. Structural problems (missing columns, unparseable
 * cells, too few rows) are {@link ValidationException}s; I/O errors propagate as-is
 * so the task can be retried.
 */
@Service
public class InventoryDataLoader {

    private static final Logger log = LoggerFactory.getLogger(InventoryDataLoader.class);

    private final PipelineConfig config;
    private final CsvMapper csvMapper;

    public InventoryDataLoader(PipelineConfig config) {
        this.config = config;
        this.csvMapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(CsvParser.Feature.EMPTY_STRING_AS_NULL)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .build();
    }

    public List<InventoryRecord> load(String source) throws IOException {
        Path path = Path.of(source);
        List<InventoryRecord> records;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<InventoryRecord> rows = csvMapper.readerFor(InventoryRecord.class)
                     .with(CsvSchema.emptySchema().withHeader())
                     .readValues(reader)) {
            records = rows.readAll();
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed inventory file " + source + ": " + e.getOriginalMessage(), e);
        }

        validate(source, records);

        records.sort(Comparator.comparing(InventoryRecord::getProductId)
                .thenComparing(InventoryRecord::getDate));

        long negatives = records.stream()
                .filter(r -> (r.getConsumption() != null && r.getConsumption() < 0)
                        || (r.getStock() != null && r.getStock() < 0))
                .count();
        if (negatives > 0) {
            log.warn("{} row(s) with negative consumption or stock in {}", negatives, source);
        }

        Map<String, Long> perProduct = records.stream()
                .collect(Collectors.groupingBy(InventoryRecord::getProductId, Collectors.counting()));
        perProduct.forEach((product, count) -> {
            if (count < config.getMinRecords()) {
                log.warn("Product {} has only {} row(s); forecasts for it will be unreliable", product, count);
            }
        });

        log.info("Loaded {} inventory rows for {} product(s) from {}", records.size(), perProduct.size(), source);
        return records;
    }

    private void validate(String source, List<InventoryRecord> records) {
        if (records.isEmpty()) {
            throw new ValidationException("Inventory file " + source + " has no rows");
        }
        if (records.size() < config.getMinRecords()) {
            throw new ValidationException("Inventory file " + source + " has " + records.size()
                    + " row(s), at least " + config.getMinRecords() + " required");
        }
        requireColumn(records, InventoryRecord::getDate, "date");
        requireColumn(records, InventoryRecord::getProductId, "product_id");
    }

    private static void requireColumn(List<InventoryRecord> records, Function<InventoryRecord, Object> getter,
                                      String column) {
        for (int i = 0; i < records.size(); i++) {
            if (getter.apply(records.get(i)) == null) {
                // +2: header line, 1-based numbering
                throw new ValidationException("Missing " + column + " on line " + (i + 2));
            }
        }
    }
}
