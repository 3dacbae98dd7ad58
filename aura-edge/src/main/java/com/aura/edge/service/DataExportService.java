package com.aura.edge.service;

import com.aura.edge.domain.TrainingSample;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes labeled training samples to a CSV file for offline analysis.
 */
@Slf4j
public class DataExportService {

    public static final String DEFAULT_FILE = "aura_training_data.csv";
    static final int MAX_ROWS = 100_000;

    private final DataStorageService store;
    private final CsvMapper csvMapper;

    public DataExportService(DataStorageService store) {
        this.store = store;
        this.csvMapper = CsvMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .build();
    }

    /**
     * @return number of rows written; nothing is written when there are no labeled samples
     */
    public int export(Path target) {
        List<TrainingSample> samples = store.getLabeledTrainingSamples(MAX_ROWS);
        if (samples.isEmpty()) {
            log.info("No labeled training samples to export");
            return 0;
        }
        CsvSchema schema = csvMapper.schemaFor(TrainingSample.class).withHeader();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            csvMapper.writer(schema).writeValue(target.toFile(), samples);
        } catch (IOException e) {
            throw new StorageException("Failed to export training data to " + target + ": " + e.getMessage(), e);
        }
        log.info("Exported {} training samples to {}", samples.size(), target.toAbsolutePath());
        return samples.size();
    }
}
