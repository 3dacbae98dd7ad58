package com.aura.edge;

import com.aura.edge.config.EngineConfig;
import com.aura.edge.config.SettingsService;
import com.aura.edge.engine.AuraEngine;
import com.aura.edge.gateway.EventSink;
import com.aura.edge.gateway.ProtocolMapper;
import com.aura.edge.monitor.ForegroundWindowProbe;
import com.aura.edge.monitor.MetricsSampler;
import com.aura.edge.service.DataExportService;
import com.aura.edge.service.DataStorageService;
import com.aura.edge.service.TrainingDataCollector;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;

/**
 * Wires the engine and its services. One instance per process; tests build their own
 * with a controllable clock and an in-memory event sink.
 */
public class EngineContext {

    private final ObjectMapper objectMapper;
    private final DataStorageService dataStorageService;
    private final SettingsService settingsService;
    private final MetricsSampler metricsSampler;
    private final TrainingDataCollector trainingDataCollector;
    private final DataExportService dataExportService;
    private final AuraEngine engine;

    public EngineContext(EngineConfig config, Clock clock, EventSink events, ForegroundWindowProbe probe) {
        this(config, clock, events, probe, ProtocolMapper.create());
    }

    EngineContext(EngineConfig config, Clock clock, EventSink events, ForegroundWindowProbe probe,
                  ObjectMapper objectMapper) {
        this(config, clock, events, probe, objectMapper,
            new DataStorageService(config.dbPath(), clock, objectMapper));
    }

    public EngineContext(EngineConfig config, Clock clock, EventSink events, ForegroundWindowProbe probe,
                         ObjectMapper objectMapper, DataStorageService store) {
        this.objectMapper = objectMapper;
        this.dataStorageService = store;
        this.settingsService = new SettingsService(store, objectMapper);
        this.metricsSampler = new MetricsSampler(probe, config.metricsWindow(), config.idleZeroThreshold(), clock);
        this.trainingDataCollector = new TrainingDataCollector(store, clock);
        this.dataExportService = new DataExportService(store);
        this.engine = new AuraEngine(config, clock, store, settingsService, metricsSampler,
            trainingDataCollector, dataExportService, events, objectMapper);
    }

    public ObjectMapper getObjectMapper() { return objectMapper; }
    public DataStorageService getDataStorageService() { return dataStorageService; }
    public SettingsService getSettingsService() { return settingsService; }
    public MetricsSampler getMetricsSampler() { return metricsSampler; }
    public TrainingDataCollector getTrainingDataCollector() { return trainingDataCollector; }
    public DataExportService getDataExportService() { return dataExportService; }
    public AuraEngine getEngine() { return engine; }
}
