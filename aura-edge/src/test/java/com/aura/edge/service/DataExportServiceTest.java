package com.aura.edge.service;

import com.aura.edge.domain.AppCategory;
import com.aura.edge.domain.TrainingSample;
import com.aura.edge.gateway.ProtocolMapper;
import com.aura.edge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DataExportService}.
 */
class DataExportServiceTest {

    @TempDir
    Path tempDir;

    private DataStorageService store;
    private DataExportService exporter;

    @BeforeEach
    void setUp() {
        store = new DataStorageService(tempDir.resolve("aura.db"), new MutableClock(), ProtocolMapper.create());
        exporter = new DataExportService(store);
    }

    @Test
    @DisplayName("only labeled samples are written, with a header row")
    void export_writesLabeledSamples() throws Exception {
        long labeled = store.logTrainingSample(
            new TrainingSample(0L, 1_705_309_200L, 42.0, 55, AppCategory.WEB, 1200, true, null));
        store.logTrainingSample(
            new TrainingSample(0L, 1_705_309_300L, 1.0, 2, AppCategory.OTHER, 60, false, null));
        store.updateTrainingResponse(labeled, TrainingSample.COMPLETED);
        Path target = tempDir.resolve("out").resolve("export.csv");

        int rows = exporter.export(target);

        assertEquals(1, rows);
        List<String> lines = Files.readAllLines(target);
        assertEquals(2, lines.size());
        String header = lines.get(0);
        assertTrue(header.startsWith("id,timestamp,mouse_velocity,keys_per_min,app_category"), header);
        assertTrue(header.contains("is_fullscreen"), header);
        assertTrue(lines.get(1).contains("Web"), lines.get(1));
    }

    @Test
    @DisplayName("nothing is written when no sample is labeled yet")
    void export_noLabeledSamples_writesNothing() {
        Path target = tempDir.resolve("empty.csv");

        assertEquals(0, exporter.export(target));
        assertFalse(Files.exists(target));
    }
}
