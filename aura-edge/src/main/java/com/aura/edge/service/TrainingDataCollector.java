package com.aura.edge.service;

import com.aura.edge.domain.AppCategory;
import com.aura.edge.domain.TrainingSample;
import com.aura.shared.ActivitySnapshot;
import com.aura.shared.protocol.Payloads;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Captures an activity feature vector every time a break fires and labels it with the
 * user's answer: completed breaks are positive samples, snoozes and skips negative ones.
 * Only timings and the app category are kept, never key content or window titles.
 */
@Slf4j
public class TrainingDataCollector {

    private final DataStorageService store;
    private final Clock clock;
    private Instant lastCompletedBreak;

    public TrainingDataCollector(DataStorageService store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.lastCompletedBreak = clock.instant();
    }

    /**
     * @return the stored sample id, to be labeled once the user answers
     */
    public long recordBreakFired(ActivitySnapshot activity) {
        Instant now = clock.instant();
        TrainingSample sample = new TrainingSample(
            0L,
            now.getEpochSecond(),
            activity.mouseVelocity(),
            activity.keysPerMinute(),
            AppCategory.categorize(activity.foregroundApp()),
            Math.max(0, Duration.between(lastCompletedBreak, now).getSeconds()),
            activity.fullscreen(),
            null
        );
        long id = store.logTrainingSample(sample);
        log.debug("Training sample {} recorded ({})", id, sample.appCategory().label());
        return id;
    }

    public void label(Long sampleId, boolean completed) {
        if (completed) {
            lastCompletedBreak = clock.instant();
        }
        if (sampleId == null) {
            return;
        }
        store.updateTrainingResponse(sampleId, completed ? TrainingSample.COMPLETED : TrainingSample.DISMISSED);
    }

    public Payloads.TrainingStats stats() {
        int[] counts = store.getTrainingCounts();
        return new Payloads.TrainingStats(counts[0], counts[1], counts[2], counts[3]);
    }
}
