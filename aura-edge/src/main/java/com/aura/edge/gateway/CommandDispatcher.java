package com.aura.edge.gateway;

import com.aura.edge.engine.AuraEngine;
import com.aura.edge.service.StorageException;
import com.aura.shared.protocol.Command;
import com.aura.shared.protocol.CommandType;
import com.aura.shared.protocol.Event;
import com.aura.shared.protocol.EventType;
import com.aura.shared.protocol.Payloads;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes a decoded command to the engine operation it names. Runs on the tick thread.
 * Rejected arguments and store failures become {@code error} events; nothing here
 * propagates out to the tick loop.
 */
@Slf4j
public class CommandDispatcher {

    static final int DEFAULT_SNOOZE_MINUTES = 5;

    private final AuraEngine engine;
    private final EventSink events;

    public CommandDispatcher(AuraEngine engine, EventSink events) {
        this.engine = engine;
        this.events = events;
    }

    public void dispatch(Command command) {
        CommandType type = command.type().orElse(null);
        if (type == null) {
            log.warn("Unknown command '{}'", command.getCmd());
            error("Unknown command: " + command.getCmd());
            return;
        }
        try {
            route(type, command);
        } catch (CommandRejectedException e) {
            log.warn("{} rejected: {}", type.wireName(), e.getMessage());
            error(e.getMessage());
        } catch (StorageException e) {
            error(e.getMessage());
        }
    }

    private void route(CommandType type, Command command) {
        switch (type) {
            case START_SESSION -> {
                engine.startSession();
                engine.emitStatus();
            }
            case PAUSE_SESSION -> {
                engine.pauseSession();
                engine.emitStatus();
            }
            case RESUME_SESSION -> {
                engine.resumeSession();
                engine.emitStatus();
            }
            case END_SESSION -> {
                engine.endSession();
                engine.emitStatus();
            }
            case GET_SESSION_STATE -> engine.emitSessionState();

            case PAUSE_REMINDERS -> {
                Integer minutes = command.getMinutes();
                if (minutes != null && minutes <= 0) {
                    throw new CommandRejectedException("minutes must be positive");
                }
                engine.pauseReminders(minutes);
                engine.emitStatus();
            }
            case RESUME_REMINDERS -> {
                engine.resumeReminders();
                engine.emitStatus();
            }

            case COMPLETE_BREAK -> {
                engine.completeBreak();
                engine.emitStatus();
            }
            case SNOOZE_BREAK -> {
                int minutes = command.getMinutes() == null ? DEFAULT_SNOOZE_MINUTES : command.getMinutes();
                if (minutes <= 0) {
                    throw new CommandRejectedException("minutes must be positive");
                }
                engine.snoozeBreak(minutes);
                engine.emitStatus();
            }
            case SKIP_BREAK -> {
                engine.skipBreak();
                engine.emitStatus();
            }
            case RESET_ALL_TIMERS -> {
                engine.resetAllTimers();
                engine.emitStatus();
            }

            case LOG_HYDRATION -> {
                Integer amount = command.getAmountMl();
                if (amount == null || amount <= 0) {
                    throw new CommandRejectedException("amount_ml must be a positive number");
                }
                engine.logHydration(amount);
            }
            case GET_HYDRATION -> engine.emitHydration();

            case GET_STATUS -> engine.emitStatus();
            case GET_METRICS -> engine.emitMetrics();

            case UPDATE_SETTING -> {
                if (command.getKey() == null || command.getKey().isBlank()) {
                    throw new CommandRejectedException("update_setting needs a key");
                }
                engine.updateSetting(command.getKey(), command.getValue());
            }
            case GET_SETTINGS -> engine.emitSettings();

            case ADD_SCHEDULE_RULE -> engine.addScheduleRule(
                command.getTime(), command.getAction(), command.getDays(), command.getTitle());
            case UPDATE_SCHEDULE_RULE -> engine.updateScheduleRule(requireId(command),
                command.getTime(), command.getAction(), command.getDays(), command.getEnabled(), command.getTitle());
            case DELETE_SCHEDULE_RULE -> engine.deleteScheduleRule(requireId(command));
            case GET_SCHEDULE_RULES -> engine.emitScheduleRules();

            case EXPORT_DATA -> engine.exportData(command.getPath());
            case GET_TRAINING_STATS -> engine.emitTrainingStats();

            case SHUTDOWN -> {
                events.emit(Event.of(EventType.SHUTDOWN_ACK));
                engine.requestShutdown();
            }
        }
    }

    private static long requireId(Command command) {
        if (command.getId() == null) {
            throw new CommandRejectedException(command.getCmd() + " needs an id");
        }
        return command.getId();
    }

    private void error(String message) {
        events.emit(Event.of(EventType.ERROR, new Payloads.ErrorMessage(message)));
    }
}
