package com.inventory.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * File-system persistence of run artifacts: CSV tables and JSON model files.
 * Every write creates missing parent directories and replaces an existing file.
 * Returned locators are the written paths as strings.
 */
@Repository
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final CsvMapper csvMapper;
    private final ObjectMapper jsonMapper;

    public ArtifactStore() {
        this.csvMapper = CsvMapper.builder()
                .addModule(new JavaTimeModule())
                .build();
        this.jsonMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Writes rows with a header line in the column order declared on {@code type}.
     * An empty list still produces the header.
     */
    public <T> String writeCsv(Path path, List<T> rows, Class<T> type) throws IOException {
        createParent(path);
        CsvSchema schema = csvMapper.schemaFor(type).withHeader();

        if (rows.isEmpty()) {
            List<String> columns = new ArrayList<>();
            for (CsvSchema.Column column : schema) {
                columns.add(column.getName());
            }
            Files.writeString(path, String.join(",", columns) + "\n", StandardCharsets.UTF_8);
        } else {
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                csvMapper.writer(schema).writeValues(writer).writeAll(rows).close();
            }
        }
        log.debug("Wrote {} row(s) to {}", rows.size(), path);
        return path.toString();
    }

    public String writeJson(Path path, Object value) throws IOException {
        createParent(path);
        jsonMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), value);
        return path.toString();
    }

    public String writeGzipJson(Path path, Object value) throws IOException {
        createParent(path);
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(path))) {
            jsonMapper.writeValue(out, value);
        }
        return path.toString();
    }

    public String writeText(Path path, String content) throws IOException {
        createParent(path);
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return path.toString();
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
