package com.aura.edge;

import com.aura.edge.config.EngineConfig;
import com.aura.edge.engine.AuraEngine;
import com.aura.edge.gateway.JsonLineTransport;
import com.aura.edge.gateway.ProtocolMapper;
import com.aura.edge.monitor.NativeInputAdapter;
import com.aura.edge.monitor.ForegroundWindowProbe;
import com.aura.edge.service.StorageException;
import com.aura.shared.protocol.Event;
import com.aura.shared.protocol.EventType;
import com.aura.shared.protocol.Payloads;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Headless entry point. The desktop shell starts this process as a sidecar and talks
 * to it over stdin/stdout; logs go to stderr.
 */
@Slf4j
public class App {

    public static void main(String[] args) {
        log.info("Starting Aura engine {}", AuraEngine.VERSION);
        EngineConfig config = EngineConfig.fromEnvironment();
        Clock clock = Clock.systemDefaultZone();
        ObjectMapper mapper = ProtocolMapper.create();
        JsonLineTransport transport = new JsonLineTransport(System.in, System.out, mapper);

        EngineContext ctx = openContext(config, clock, transport, mapper);
        if (ctx == null) {
            System.exit(1);
            return;
        }

        NativeInputAdapter input = new NativeInputAdapter(ctx.getMetricsSampler(), clock);
        if (config.nativeInput()) {
            input.start();
        }

        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean stopped = new AtomicBoolean();
        Runnable shutdown = () -> {
            if (stopped.compareAndSet(false, true)) {
                input.stop();
                ctx.getEngine().stop();
            }
        };
        Runtime.getRuntime().addShutdownHook(new Thread(shutdown, "aura-shutdown"));

        ctx.getEngine().onShutdownRequested(done::countDown);
        ctx.getEngine().start();
        transport.start(ctx.getEngine()::submit, done::countDown);

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        shutdown.run();
        System.exit(0);
    }

    private static EngineContext openContext(EngineConfig config, Clock clock, JsonLineTransport transport,
                                             ObjectMapper mapper) {
        try {
            ForegroundWindowProbe probe = ForegroundWindowProbe.forCurrentOs();
            log.info("Foreground window probe: {}", probe.getClass().getSimpleName());
            return new EngineContext(config, clock, transport, probe, mapper);
        } catch (StorageException e) {
            log.error("Cannot open store at {}", config.dbPath(), e);
            transport.emit(Event.of(EventType.ERROR, new Payloads.ErrorMessage("Startup failed: " + e.getMessage())));
            return null;
        }
    }
}
