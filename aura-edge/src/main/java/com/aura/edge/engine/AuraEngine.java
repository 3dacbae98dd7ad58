package com.aura.edge.engine;

import com.aura.edge.config.EngineConfig;
import com.aura.edge.config.SettingKey;
import com.aura.edge.config.SettingsService;
import com.aura.edge.domain.EngineCheckpoint;
import com.aura.edge.domain.TimerMode;
import com.aura.edge.gateway.CommandDispatcher;
import com.aura.edge.gateway.CommandRejectedException;
import com.aura.edge.gateway.EventSink;
import com.aura.edge.monitor.MetricsSampler;
import com.aura.edge.schedule.RuleValidator;
import com.aura.edge.schedule.ScheduleRuleEngine;
import com.aura.edge.scheduler.BreakConfig;
import com.aura.edge.scheduler.BreakTimer;
import com.aura.edge.scheduler.BreakTimerSet;
import com.aura.edge.scheduler.SessionStateMachine;
import com.aura.edge.service.DataExportService;
import com.aura.edge.service.DataStorageService;
import com.aura.edge.service.StorageException;
import com.aura.edge.service.TrainingDataCollector;
import com.aura.shared.ActivitySnapshot;
import com.aura.shared.ActivityState;
import com.aura.shared.BreakKind;
import com.aura.shared.ScheduleAction;
import com.aura.shared.ScheduleRule;
import com.aura.shared.SessionState;
import com.aura.shared.Weekday;
import com.aura.shared.protocol.Command;
import com.aura.shared.protocol.Event;
import com.aura.shared.protocol.EventType;
import com.aura.shared.protocol.Payloads;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * The activity and break scheduling engine.
 * <p>
 * All engine state is owned by one tick thread. Each tick drains queued commands,
 * samples activity, handles the day rollover, advances the break timers, evaluates
 * schedule rules, broadcasts metrics and checkpoints periodically. Other threads only
 * touch the command queue ({@link #submit(Command)}) and the sampler's input queue.
 */
@Slf4j
public class AuraEngine {

    public static final String VERSION = "1.4.0";

    private final EngineConfig config;
    private final Clock clock;
    private final DataStorageService store;
    private final SettingsService settings;
    private final MetricsSampler sampler;
    private final TrainingDataCollector training;
    private final DataExportService exporter;
    private final EventSink events;
    private final ObjectMapper mapper;

    private final SessionStateMachine session = new SessionStateMachine();
    private final ScheduleRuleEngine rules = new ScheduleRuleEngine();
    private final BreakTimerSet timers;
    private final CommandDispatcher dispatcher;

    private final BlockingQueue<Command> commands = new LinkedBlockingQueue<>();
    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "aura-tick");
        thread.setDaemon(true);
        return thread;
    });

    private TimerMode mode = TimerMode.WALL_CLOCK;
    private ActivitySnapshot activity;
    private Instant lastTick;
    private Instant lastCheckpoint;
    private LocalDate currentDay;
    private volatile Runnable shutdownListener = () -> { };

    public AuraEngine(EngineConfig config, Clock clock, DataStorageService store, SettingsService settings,
                      MetricsSampler sampler, TrainingDataCollector training, DataExportService exporter,
                      EventSink events, ObjectMapper mapper) {
        this.config = config;
        this.clock = clock;
        this.store = store;
        this.settings = settings;
        this.sampler = sampler;
        this.training = training;
        this.exporter = exporter;
        this.events = events;
        this.mapper = mapper;

        Map<BreakKind, BreakConfig> configs = new EnumMap<>(BreakKind.class);
        for (BreakKind kind : BreakKind.values()) {
            configs.put(kind, settings.breakConfig(kind));
        }
        this.timers = new BreakTimerSet(configs);
        this.dispatcher = new CommandDispatcher(this, events);
    }

    // ---- lifecycle ----

    /**
     * Loads settings, rules and the last checkpoint and announces readiness. Called by
     * {@link #start()}; tests drive {@link #tick()} directly after calling this.
     */
    public void initialize() {
        applySamplerSettings();
        mode = settings.timerMode();
        reloadRules();
        restoreCheckpoint();

        Instant now = clock.instant();
        currentDay = LocalDate.now(clock);
        refreshHydrationSilence();
        activity = sampler.sample(now);
        lastTick = now;
        lastCheckpoint = now;

        emit(EventType.READY, new Payloads.Ready(VERSION, store.getDbPath().toAbsolutePath().toString()));
        if (timers.getPending() != null) {
            emitBreakDue(timers.getPending());
        }
        log.info("Engine ready: session={} mode={} rules={}", session.state().wireName(), mode.wireName(),
            rules.rules().size());
    }

    public void start() {
        initialize();
        long period = config.tickPeriod().toMillis();
        executor.scheduleAtFixedRate(this::safeTick, period, period, TimeUnit.MILLISECONDS);
        log.info("Tick loop started every {} ms", period);
    }

    public void stop() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Tick loop did not stop in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        try {
            saveCheckpoint();
        } catch (StorageException e) {
            log.error("Final checkpoint failed: {}", e.getMessage());
        }
        emit(EventType.SHUTDOWN, null);
        log.info("Engine stopped");
    }

    public void submit(Command command) {
        commands.add(command);
    }

    public void onShutdownRequested(Runnable listener) {
        this.shutdownListener = listener;
    }

    public void requestShutdown() {
        log.info("Shutdown requested by host");
        shutdownListener.run();
    }

    // ---- tick ----

    void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Tick failed", e);
            emitError("Engine tick failed: " + e.getMessage());
        }
    }

    public void tick() {
        Instant now = clock.instant();
        long deltaMillis = Math.max(0, Duration.between(lastTick, now).toMillis());
        lastTick = now;

        drainCommands();

        if (session.expireReminderPause(now)) {
            emit(EventType.REMINDERS_RESUMED, null);
            checkpointQuietly();
        }

        ActivityState previous = activity.state();
        activity = sampler.sample(now);
        if (activity.state() != previous) {
            emit(EventType.STATE_CHANGE, new Payloads.StateChange(activity.state()));
        }

        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDay)) {
            log.info("Day rollover {} -> {}", currentDay, today);
            currentDay = today;
            refreshHydrationSilence();
        }

        timers.tick(deltaMillis, session.isActive(), session.remindersPaused(now), activity.state(), mode, today)
            .ifPresent(this::onBreakFired);

        evaluateRules(LocalDateTime.now(clock));

        emitMetrics();

        if (Duration.between(lastCheckpoint, now).compareTo(config.checkpointInterval()) >= 0) {
            checkpointQuietly();
        }
    }

    private void drainCommands() {
        Command command;
        while ((command = commands.poll()) != null) {
            dispatcher.dispatch(command);
        }
    }

    private void onBreakFired(BreakKind kind) {
        BreakTimer timer = timers.timer(kind);
        Long logId = timer.logId();
        Long sampleId = null;
        try {
            if (logId == null) {
                logId = store.logBreak(kind, timer.durationSeconds());
            }
            sampleId = training.recordBreakFired(activity);
            timers.attachLog(kind, logId, sampleId);
            saveCheckpoint();
        } catch (StorageException e) {
            timers.attachLog(kind, logId, sampleId);
            emitError(e.getMessage());
        }
        emitBreakDue(kind);
    }

    private void emitBreakDue(BreakKind kind) {
        BreakTimer timer = timers.timer(kind);
        emit(EventType.BREAK_DUE, new Payloads.BreakDue(kind, timer.durationSeconds(), kind.themeColor(), timer.logId()));
    }

    private void evaluateRules(LocalDateTime now) {
        ScheduleRuleEngine.Evaluation evaluation = rules.evaluate(now);
        for (ScheduleRuleEngine.Warning warning : evaluation.warnings()) {
            ScheduleRule rule = warning.rule();
            log.info("Schedule warning: {} in {}s", rule.displayTitle(), warning.secondsRemaining());
            emit(EventType.SCHEDULE_WARNING, new Payloads.ScheduleWarning(
                rule.action(), rule.time(), rule.displayTitle(), warning.secondsRemaining()));
        }
        for (ScheduleRule rule : evaluation.fired()) {
            try {
                execute(rule.action());
            } catch (StorageException e) {
                emitError(e.getMessage());
                continue;
            }
            log.info("Schedule rule {} executed: {}", rule.id(), rule.displayTitle());
            emit(EventType.SCHEDULE_ACTION_EXECUTED, new Payloads.ScheduleActionExecuted(
                rule.action(), rule.time(), rule.displayTitle()));
            emitStatus();
        }
    }

    private void execute(ScheduleAction action) {
        switch (action) {
            case PAUSE -> pauseSession();
            case RESUME -> resumeSession();
            case RESET -> resetAllTimers();
            case START_SESSION -> startSession();
            case END_SESSION -> endSession();
        }
    }

    // ---- session ----

    public void startSession() {
        SessionState before = session.state();
        boolean changed = durably(() -> {
            if (!session.start()) {
                return false;
            }
            if (before == SessionState.IDLE) {
                timers.clear();
            }
            return true;
        });
        if (changed) {
            log.info("Session started");
            emit(EventType.SESSION_STARTED, new Payloads.SessionInfo(session.state()));
        }
    }

    public void pauseSession() {
        if (durably(session::pause)) {
            log.info("Session paused");
            emit(EventType.SESSION_PAUSED, new Payloads.SessionInfo(session.state()));
        }
    }

    public void resumeSession() {
        if (durably(session::resume)) {
            log.info("Session resumed");
            emit(EventType.SESSION_RESUMED, new Payloads.SessionInfo(session.state()));
        }
    }

    public void endSession() {
        boolean changed = durably(() -> {
            if (!session.end()) {
                return false;
            }
            timers.clear();
            return true;
        });
        if (changed) {
            log.info("Session ended");
            emit(EventType.SESSION_ENDED, new Payloads.SessionInfo(session.state()));
        }
    }

    /**
     * @param minutes length of the pause, or {@code null} to pause until resumed
     */
    public void pauseReminders(Integer minutes) {
        Instant until = minutes == null ? null : clock.instant().plus(Duration.ofMinutes(minutes));
        durably(() -> {
            session.pauseReminders(until);
            return true;
        });
        log.info("Reminders paused {}", minutes == null ? "indefinitely" : "for " + minutes + " min");
        emit(EventType.REMINDERS_PAUSED, new Payloads.RemindersPaused(minutes));
    }

    public void resumeReminders() {
        if (durably(session::resumeReminders)) {
            log.info("Reminders resumed");
            emit(EventType.REMINDERS_RESUMED, null);
        }
    }

    // ---- breaks ----

    public void completeBreak() {
        resolve(timers::complete, true, false, false, EventType.BREAK_COMPLETED, null);
    }

    public void snoozeBreak(int minutes) {
        resolve(() -> timers.snooze(minutes), false, false, true, EventType.BREAK_SNOOZED,
            new Payloads.BreakSnoozed(minutes));
    }

    public void skipBreak() {
        resolve(timers::skip, false, true, false, EventType.BREAK_SKIPPED, null);
    }

    private void resolve(Supplier<Optional<BreakTimerSet.Resolution>> operation,
                         boolean completed, boolean skipped, boolean snoozed, EventType ack, Object payload) {
        EngineCheckpoint before = checkpoint();
        Optional<BreakTimerSet.Resolution> resolution = operation.get();
        if (resolution.isEmpty()) {
            return;
        }
        BreakTimerSet.Resolution released = resolution.get();
        try {
            if (released.logId() != null) {
                store.updateBreakLog(released.logId(), completed, skipped, snoozed);
            }
            training.label(released.trainingSampleId(), completed);
            saveCheckpoint();
        } catch (StorageException e) {
            restore(before);
            throw e;
        }
        log.info("{} break {}", released.kind().wireName(), ack.wireName().substring("break_".length()));
        emit(ack, payload);
    }

    public void resetAllTimers() {
        durably(() -> {
            timers.resetAll();
            return true;
        });
        log.info("All timers reset");
        emit(EventType.TIMERS_RESET, null);
    }

    // ---- hydration ----

    public void logHydration(int amountMl) {
        store.logHydration(amountMl);
        int total = store.getHydrationToday();
        int goal = settings.waterGoal();
        refreshHydrationSilence(total, goal);
        log.info("Hydration +{} ml, {} / {} ml today", amountMl, total, goal);
        emit(EventType.HYDRATION_LOGGED, Payloads.Hydration.of(amountMl, total, goal));
    }

    public void emitHydration() {
        emit(EventType.HYDRATION_STATUS, hydration());
    }

    private Payloads.Hydration hydration() {
        return Payloads.Hydration.of(null, store.getHydrationToday(), settings.waterGoal());
    }

    private void refreshHydrationSilence() {
        refreshHydrationSilence(store.getHydrationToday(), settings.waterGoal());
    }

    private void refreshHydrationSilence(int totalToday, int goal) {
        boolean wasSilenced = timers.isHydrationSilenced(currentDay);
        boolean silenced = totalToday >= goal;
        timers.silenceHydration(silenced ? currentDay : null);
        if (silenced != wasSilenced) {
            log.info("Hydration reminders {} ({} / {} ml)", silenced ? "silenced for today" : "active", totalToday, goal);
        }
    }

    // ---- settings ----

    public void updateSetting(String key, String value) {
        Map.Entry<SettingKey, String> updated = settings.update(key, value);
        SettingKey setting = updated.getKey();

        Optional<BreakKind> kind = SettingsService.breakKindOf(setting);
        if (kind.isPresent()) {
            timers.reloadAndReset(kind.get(), settings.breakConfig(kind.get()));
            checkpointQuietly();
        }
        switch (setting) {
            case TIMER_MODE -> mode = settings.timerMode();
            case IDLE_THRESHOLD, AUTO_DETECT_FULLSCREEN, BLOCKLIST_PROCESSES -> applySamplerSettings();
            case WATER_GOAL -> refreshHydrationSilence();
            default -> {
            }
        }
        emit(EventType.SETTING_UPDATED, new Payloads.SettingUpdated(setting.key(), updated.getValue()));
        if (kind.isPresent() || setting == SettingKey.TIMER_MODE) {
            emitStatus();
        }
    }

    public void emitSettings() {
        emit(EventType.SETTINGS, settings.all());
    }

    private void applySamplerSettings() {
        sampler.setIdleThreshold(settings.idleThreshold());
        sampler.setAutoDetectFullscreen(settings.autoDetectFullscreen());
        sampler.setBlocklist(settings.blocklist());
    }

    // ---- schedule rules ----

    public void addScheduleRule(String time, String action, List<String> days, String title) {
        RuleValidator.ValidRule rule = RuleValidator.validate(time, action, days, title);
        long id = store.addScheduleRule(rule.time(), rule.action(), rule.days(), rule.title());
        reloadRules();
        log.info("Schedule rule {} added: {} at {}", id, rule.action().wireName(), rule.time());
        emit(EventType.SCHEDULE_RULE_ADDED, new Payloads.RuleChange(id, store.getScheduleRules()));
    }

    /**
     * Fields left {@code null} keep their stored value.
     */
    public void updateScheduleRule(long id, String time, String action, List<String> days, Boolean enabled,
                                   String title) {
        Optional<ScheduleRule> existing = store.findScheduleRule(id);
        if (existing.isEmpty()) {
            log.warn("update_schedule_rule ignored, no rule with id {}", id);
            emitScheduleRules();
            return;
        }
        ScheduleRule current = existing.get();
        RuleValidator.ValidRule rule = RuleValidator.validate(
            time == null ? current.time() : time,
            action == null ? current.action().wireName() : action,
            days == null ? current.days().stream().map(Weekday::wireName).toList() : days,
            title == null ? current.title() : title);
        boolean enable = enabled == null ? current.enabled() : enabled;
        store.updateScheduleRule(id, rule.time(), rule.action(), rule.days(), enable, rule.title());
        reloadRules();
        log.info("Schedule rule {} updated", id);
        emit(EventType.SCHEDULE_RULE_UPDATED, new Payloads.RuleChange(id, store.getScheduleRules()));
    }

    public void deleteScheduleRule(long id) {
        if (!store.deleteScheduleRule(id)) {
            log.warn("delete_schedule_rule ignored, no rule with id {}", id);
            emitScheduleRules();
            return;
        }
        reloadRules();
        log.info("Schedule rule {} deleted", id);
        emit(EventType.SCHEDULE_RULE_DELETED, new Payloads.RuleChange(id, store.getScheduleRules()));
    }

    public void emitScheduleRules() {
        emit(EventType.SCHEDULE_RULES, new Payloads.RuleList(store.getScheduleRules()));
    }

    private void reloadRules() {
        rules.reload(store.getEnabledScheduleRules());
    }

    // ---- data ----

    public void exportData(String path) {
        String target = path == null || path.isBlank() ? DataExportService.DEFAULT_FILE : path;
        Path file;
        try {
            file = Path.of(target);
        } catch (InvalidPathException e) {
            throw new CommandRejectedException("Invalid export path '" + target + "'");
        }
        int records = exporter.export(file);
        emit(EventType.DATA_EXPORTED, new Payloads.DataExported(target, records));
    }

    public void emitTrainingStats() {
        emit(EventType.TRAINING_STATS, training.stats());
    }

    // ---- status ----

    public void emitStatus() {
        Instant pauseUntil = session.pauseUntil();
        Payloads.SchedulerStatus scheduler = new Payloads.SchedulerStatus(
            session.state(),
            session.remindersPaused(clock.instant()),
            pauseUntil == null ? null : pauseUntil.getEpochSecond(),
            mode.wireName(),
            timers.getPending(),
            timers.status(currentDay)
        );
        emit(EventType.STATUS, new Payloads.Status(activity, scheduler, timers.nextBreak(mode, currentDay), hydration()));
    }

    public void emitMetrics() {
        emit(EventType.METRICS, new Payloads.Metrics(activity, timers.nextBreak(mode, currentDay)));
    }

    public void emitSessionState() {
        emit(EventType.SESSION_STATE, new Payloads.SessionInfo(session.state()));
    }

    public SessionState sessionState() {
        return session.state();
    }

    public BreakTimerSet timers() {
        return timers;
    }

    public TimerMode timerMode() {
        return mode;
    }

    // ---- durability ----

    /**
     * Runs a state mutation and checkpoints it before returning. If the checkpoint
     * cannot be written, the in-memory state is put back and the failure propagates.
     *
     * @return whether the mutation changed anything
     */
    private boolean durably(BooleanSupplier mutation) {
        EngineCheckpoint before = checkpoint();
        if (!mutation.getAsBoolean()) {
            return false;
        }
        try {
            saveCheckpoint();
        } catch (StorageException e) {
            restore(before);
            throw e;
        }
        return true;
    }

    EngineCheckpoint checkpoint() {
        Instant pauseUntil = session.pauseUntil();
        return new EngineCheckpoint(
            session.state(),
            pauseUntil == null ? null : pauseUntil.toEpochMilli(),
            session.remindersPaused(),
            timers.snapshot(),
            timers.getPending()
        );
    }

    private void restore(EngineCheckpoint saved) {
        session.restore(saved.sessionState(), saved.remindersPaused(),
            saved.pauseUntilMillis() == null ? null : Instant.ofEpochMilli(saved.pauseUntilMillis()));
        timers.restore(saved.timers(), saved.pendingBreak());
    }

    private void saveCheckpoint() {
        String json;
        try {
            json = mapper.writeValueAsString(checkpoint());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode engine checkpoint", e);
        }
        store.saveCheckpoint(json);
        lastCheckpoint = clock.instant();
    }

    private void checkpointQuietly() {
        try {
            saveCheckpoint();
        } catch (StorageException e) {
            emitError(e.getMessage());
        }
    }

    private void restoreCheckpoint() {
        Optional<String> stored = store.loadCheckpoint();
        if (stored.isEmpty()) {
            log.info("No checkpoint found, starting idle");
            return;
        }
        try {
            EngineCheckpoint saved = mapper.readValue(stored.get(), EngineCheckpoint.class);
            restore(saved);
            log.info("Restored checkpoint: session={} pending={}", session.state().wireName(),
                saved.pendingBreak() == null ? "none" : saved.pendingBreak().wireName());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable checkpoint: {}", e.getOriginalMessage());
        }
    }

    // ---- events ----

    private void emit(EventType type, Object payload) {
        events.emit(payload == null ? Event.of(type) : Event.of(type, payload));
    }

    private void emitError(String message) {
        events.emit(Event.of(EventType.ERROR, new Payloads.ErrorMessage(message)));
    }
}
