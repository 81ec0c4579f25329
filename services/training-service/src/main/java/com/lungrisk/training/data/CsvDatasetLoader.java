package com.lungrisk.training.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a headed CSV file into a {@link RawDataset}.
 */
@Slf4j
@Component
public class CsvDatasetLoader {

    private final CsvMapper csvMapper;

    public CsvDatasetLoader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public RawDataset load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toAbsolutePath().toString(), null, "training data not found");
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(path.toFile())) {
            List<Map<String, String>> rows = iterator.readAll();

            List<String> columns = new ArrayList<>();
            if (iterator.getParserSchema() instanceof CsvSchema headerSchema) {
                for (CsvSchema.Column column : headerSchema) {
                    columns.add(column.getName());
                }
            }
            if (columns.isEmpty() && !rows.isEmpty()) {
                columns.addAll(rows.get(0).keySet());
            }
            log.info("Loaded {} rows with columns {} from {}", rows.size(), columns, path.toAbsolutePath());
            return new RawDataset(path.toAbsolutePath().toString(), columns, rows);
        }
    }
}
