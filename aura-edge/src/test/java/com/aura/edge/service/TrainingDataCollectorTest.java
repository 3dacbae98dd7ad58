package com.aura.edge.service;

import com.aura.edge.domain.AppCategory;
import com.aura.edge.domain.TrainingSample;
import com.aura.edge.gateway.ProtocolMapper;
import com.aura.edge.support.MutableClock;
import com.aura.shared.ActivitySnapshot;
import com.aura.shared.ActivityState;
import com.aura.shared.protocol.Payloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link TrainingDataCollector}.
 */
class TrainingDataCollectorTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private DataStorageService store;
    private TrainingDataCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new DataStorageService(tempDir.resolve("aura.db"), clock, ProtocolMapper.create());
        collector = new TrainingDataCollector(store, clock);
    }

    private static ActivitySnapshot activity(String app) {
        return new ActivitySnapshot(15.0, 80, 300, 0, ActivityState.ACTIVE, app, false);
    }

    @Test
    @DisplayName("samples carry the app category and time since the last completed break")
    void recordBreakFired_capturesFeatures() {
        clock.advanceSeconds(900);
        long first = collector.recordBreakFired(activity("Code.exe"));
        collector.label(first, true);

        clock.advanceSeconds(300);
        long second = collector.recordBreakFired(activity("slack.exe"));
        collector.label(second, false);

        List<TrainingSample> samples = store.getLabeledTrainingSamples(10);
        TrainingSample newest = samples.get(0);
        TrainingSample oldest = samples.get(1);
        assertEquals(AppCategory.CODE, oldest.appCategory());
        assertEquals(900, oldest.timeSinceLastBreak());
        assertEquals(TrainingSample.COMPLETED, oldest.userResponse());
        assertEquals(AppCategory.COMMUNICATION, newest.appCategory());
        assertEquals(300, newest.timeSinceLastBreak());
        assertEquals(TrainingSample.DISMISSED, newest.userResponse());
    }

    @Test
    @DisplayName("stats split labeled samples into completed and dismissed")
    void stats_countsLabels() {
        collector.label(collector.recordBreakFired(activity("")), true);
        collector.label(collector.recordBreakFired(activity("")), false);
        collector.recordBreakFired(activity(""));

        assertEquals(new Payloads.TrainingStats(3, 2, 1, 1), collector.stats());
    }
}
