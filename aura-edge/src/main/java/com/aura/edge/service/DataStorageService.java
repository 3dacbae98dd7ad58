package com.aura.edge.service;

import com.aura.edge.config.SettingKey;
import com.aura.edge.domain.AppCategory;
import com.aura.edge.domain.TrainingSample;
import com.aura.shared.BreakKind;
import com.aura.shared.BreakLog;
import com.aura.shared.ScheduleAction;
import com.aura.shared.ScheduleRule;
import com.aura.shared.Weekday;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed store for settings, break and hydration logs, schedule rules, training
 * samples and the engine checkpoint. Every call opens its own short connection and
 * transaction, so there is never a long-lived writer blocking the tick loop.
 */
@Slf4j
public class DataStorageService {

    private static final String[] SCHEMA = {
        "CREATE TABLE IF NOT EXISTS settings (" +
            "key TEXT PRIMARY KEY, " +
            "value TEXT NOT NULL, " +
            "updated_at INTEGER NOT NULL)",
        "CREATE TABLE IF NOT EXISTS break_logs (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
            "timestamp INTEGER NOT NULL, " +
            "break_type TEXT NOT NULL, " +
            "duration_seconds INTEGER NOT NULL, " +
            "completed INTEGER NOT NULL DEFAULT 0, " +
            "skipped INTEGER NOT NULL DEFAULT 0, " +
            "snoozed INTEGER NOT NULL DEFAULT 0)",
        "CREATE TABLE IF NOT EXISTS hydration_logs (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
            "timestamp INTEGER NOT NULL, " +
            "amount_ml INTEGER NOT NULL)",
        "CREATE TABLE IF NOT EXISTS schedule_rules (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
            "title TEXT NOT NULL DEFAULT '', " +
            "time TEXT NOT NULL, " +
            "action TEXT NOT NULL, " +
            "days TEXT NOT NULL, " +
            "enabled INTEGER NOT NULL DEFAULT 1, " +
            "created_at INTEGER NOT NULL)",
        "CREATE TABLE IF NOT EXISTS training_data (" +
            "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
            "timestamp INTEGER NOT NULL, " +
            "mouse_velocity REAL NOT NULL, " +
            "keys_per_minute INTEGER NOT NULL, " +
            "app_category TEXT NOT NULL, " +
            "time_since_last_break INTEGER NOT NULL, " +
            "is_fullscreen INTEGER NOT NULL DEFAULT 0, " +
            "user_response INTEGER)",
        "CREATE TABLE IF NOT EXISTS engine_state (" +
            "key TEXT PRIMARY KEY, " +
            "value TEXT NOT NULL, " +
            "updated_at INTEGER NOT NULL)",
        "CREATE INDEX IF NOT EXISTS idx_break_logs_timestamp ON break_logs(timestamp)",
        "CREATE INDEX IF NOT EXISTS idx_hydration_logs_timestamp ON hydration_logs(timestamp)",
        "CREATE INDEX IF NOT EXISTS idx_training_data_timestamp ON training_data(timestamp)"
    };

    private static final String CHECKPOINT_KEY = "checkpoint";

    private final Path dbPath;
    private final String url;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public DataStorageService(Path dbPath, Clock clock, ObjectMapper objectMapper) {
        this.dbPath = dbPath;
        this.url = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = clock;
        this.objectMapper = objectMapper;

        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create database directory for " + dbPath, e);
        }
        initSchema();
        log.info("Store ready at {}", dbPath.toAbsolutePath());
    }

    public Path getDbPath() {
        return dbPath;
    }

    private void initSchema() {
        inTransaction("initialize schema", conn -> {
            try (Statement stmt = conn.createStatement()) {
                for (String ddl : SCHEMA) {
                    stmt.execute(ddl);
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT OR IGNORE INTO settings (key, value, updated_at) VALUES (?, ?, ?)")) {
                for (SettingKey setting : SettingKey.values()) {
                    stmt.setString(1, setting.key());
                    stmt.setString(2, setting.defaultValue());
                    stmt.setLong(3, nowSeconds());
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            return null;
        });
    }

    // ---- settings ----

    public Optional<String> getSetting(String key) {
        return inTransaction("read setting " + key, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT value FROM settings WHERE key = ?")) {
                stmt.setString(1, key);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getString(1)) : Optional.<String>empty();
                }
            }
        });
    }

    public String getSetting(SettingKey key) {
        return getSetting(key.key()).orElse(key.defaultValue());
    }

    public int getIntSetting(SettingKey key) {
        String raw = getSetting(key);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Stored value {}={} is not a number, using default {}", key.key(), raw, key.defaultValue());
            return Integer.parseInt(key.defaultValue());
        }
    }

    public boolean getBooleanSetting(SettingKey key) {
        return "true".equalsIgnoreCase(getSetting(key).trim());
    }

    public void setSetting(String key, String value) {
        inTransaction("write setting " + key, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO settings (key, value, updated_at) VALUES (?, ?, ?) " +
                    "ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at")) {
                stmt.setString(1, key);
                stmt.setString(2, value);
                stmt.setLong(3, nowSeconds());
                stmt.executeUpdate();
            }
            return null;
        });
    }

    public Map<String, String> getAllSettings() {
        return inTransaction("read settings", conn -> {
            Map<String, String> settings = new LinkedHashMap<>();
            try (PreparedStatement stmt = conn.prepareStatement("SELECT key, value FROM settings ORDER BY key");
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    settings.put(rs.getString("key"), rs.getString("value"));
                }
            }
            return settings;
        });
    }

    // ---- break logs ----

    public long logBreak(BreakKind kind, int durationSeconds) {
        return inTransaction("append break log", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO break_logs (timestamp, break_type, duration_seconds, completed, skipped, snoozed) " +
                    "VALUES (?, ?, ?, 0, 0, 0)")) {
                stmt.setLong(1, nowSeconds());
                stmt.setString(2, kind.wireName());
                stmt.setInt(3, durationSeconds);
                stmt.executeUpdate();
            }
            return lastInsertId(conn);
        });
    }

    /**
     * Resolves a break log row. Exactly one of the flags is expected to be set.
     */
    public void updateBreakLog(long id, boolean completed, boolean skipped, boolean snoozed) {
        inTransaction("update break log " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "UPDATE break_logs SET completed = ?, skipped = ?, snoozed = ? WHERE id = ?")) {
                stmt.setInt(1, completed ? 1 : 0);
                stmt.setInt(2, skipped ? 1 : 0);
                stmt.setInt(3, snoozed ? 1 : 0);
                stmt.setLong(4, id);
                if (stmt.executeUpdate() == 0) {
                    log.warn("Break log {} does not exist, nothing updated", id);
                }
            }
            return null;
        });
    }

    public Optional<BreakLog> findBreakLog(long id) {
        return inTransaction("read break log " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT * FROM break_logs WHERE id = ?")) {
                stmt.setLong(1, id);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(toBreakLog(rs)) : Optional.<BreakLog>empty();
                }
            }
        });
    }

    public List<BreakLog> getBreaksToday() {
        return inTransaction("read today's breaks", conn -> {
            List<BreakLog> logs = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT * FROM break_logs WHERE timestamp >= ? ORDER BY id")) {
                stmt.setLong(1, startOfToday());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        logs.add(toBreakLog(rs));
                    }
                }
            }
            return logs;
        });
    }

    private BreakLog toBreakLog(ResultSet rs) throws SQLException {
        return new BreakLog(
            rs.getLong("id"),
            rs.getLong("timestamp"),
            BreakKind.fromWire(rs.getString("break_type")).orElse(BreakKind.MICRO),
            rs.getInt("duration_seconds"),
            rs.getInt("completed") != 0,
            rs.getInt("skipped") != 0,
            rs.getInt("snoozed") != 0
        );
    }

    // ---- hydration ----

    public long logHydration(int amountMl) {
        return inTransaction("append hydration log", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO hydration_logs (timestamp, amount_ml) VALUES (?, ?)")) {
                stmt.setLong(1, nowSeconds());
                stmt.setInt(2, amountMl);
                stmt.executeUpdate();
            }
            return lastInsertId(conn);
        });
    }

    /** Total intake since local midnight, always summed from the log. */
    public int getHydrationToday() {
        return inTransaction("sum today's hydration", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT COALESCE(SUM(amount_ml), 0) FROM hydration_logs WHERE timestamp >= ?")) {
                stmt.setLong(1, startOfToday());
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    // ---- schedule rules ----

    public long addScheduleRule(String time, ScheduleAction action, Set<Weekday> days, String title) {
        String daysJson = writeDays(days);
        return inTransaction("insert schedule rule", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO schedule_rules (title, time, action, days, enabled, created_at) VALUES (?, ?, ?, ?, 1, ?)")) {
                stmt.setString(1, title == null ? "" : title);
                stmt.setString(2, time);
                stmt.setString(3, action.wireName());
                stmt.setString(4, daysJson);
                stmt.setLong(5, nowSeconds());
                stmt.executeUpdate();
            }
            return lastInsertId(conn);
        });
    }

    /**
     * @return {@code false} when no rule has the given id
     */
    public boolean updateScheduleRule(long id, String time, ScheduleAction action, Set<Weekday> days,
                                      boolean enabled, String title) {
        String daysJson = writeDays(days);
        return inTransaction("update schedule rule " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "UPDATE schedule_rules SET title = ?, time = ?, action = ?, days = ?, enabled = ? WHERE id = ?")) {
                stmt.setString(1, title == null ? "" : title);
                stmt.setString(2, time);
                stmt.setString(3, action.wireName());
                stmt.setString(4, daysJson);
                stmt.setInt(5, enabled ? 1 : 0);
                stmt.setLong(6, id);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    /**
     * @return {@code false} when no rule has the given id
     */
    public boolean deleteScheduleRule(long id) {
        return inTransaction("delete schedule rule " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("DELETE FROM schedule_rules WHERE id = ?")) {
                stmt.setLong(1, id);
                return stmt.executeUpdate() > 0;
            }
        });
    }

    /** All rules, ordered by time of day for display. */
    public List<ScheduleRule> getScheduleRules() {
        return queryRules("SELECT * FROM schedule_rules ORDER BY time, id");
    }

    /** Enabled rules in ascending id, the order same-minute rules execute in. */
    public List<ScheduleRule> getEnabledScheduleRules() {
        return queryRules("SELECT * FROM schedule_rules WHERE enabled = 1 ORDER BY id");
    }

    public Optional<ScheduleRule> findScheduleRule(long id) {
        return getScheduleRules().stream().filter(rule -> rule.id() == id).findFirst();
    }

    private List<ScheduleRule> queryRules(String sql) {
        return inTransaction("read schedule rules", conn -> {
            List<ScheduleRule> rules = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql);
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    String action = rs.getString("action");
                    Optional<ScheduleAction> parsed = ScheduleAction.fromWire(action);
                    if (parsed.isEmpty()) {
                        log.warn("Skipping schedule rule {} with unknown action '{}'", rs.getLong("id"), action);
                        continue;
                    }
                    rules.add(new ScheduleRule(
                        rs.getLong("id"),
                        rs.getString("title"),
                        rs.getString("time"),
                        parsed.get(),
                        readDays(rs.getString("days")),
                        rs.getInt("enabled") != 0,
                        rs.getLong("created_at")
                    ));
                }
            }
            return rules;
        });
    }

    private String writeDays(Collection<Weekday> days) {
        try {
            return objectMapper.writeValueAsString(days);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot encode rule days " + days, e);
        }
    }

    private Set<Weekday> readDays(String json) {
        Set<Weekday> days = EnumSet.noneOf(Weekday.class);
        try {
            List<String> names = objectMapper.readValue(json, new TypeReference<List<String>>() { });
            for (String name : names) {
                Weekday.fromWire(name).ifPresent(days::add);
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable rule days '{}': {}", json, e.getMessage());
        }
        return days;
    }

    // ---- training data ----

    public long logTrainingSample(TrainingSample sample) {
        return inTransaction("append training sample", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO training_data (timestamp, mouse_velocity, keys_per_minute, app_category, " +
                    "time_since_last_break, is_fullscreen, user_response) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                stmt.setLong(1, sample.timestamp());
                stmt.setDouble(2, sample.mouseVelocity());
                stmt.setInt(3, sample.keysPerMinute());
                stmt.setString(4, sample.appCategory().label());
                stmt.setLong(5, sample.timeSinceLastBreak());
                stmt.setInt(6, sample.fullscreen() ? 1 : 0);
                if (sample.userResponse() == null) {
                    stmt.setNull(7, Types.INTEGER);
                } else {
                    stmt.setInt(7, sample.userResponse());
                }
                stmt.executeUpdate();
            }
            return lastInsertId(conn);
        });
    }

    public void updateTrainingResponse(long id, int userResponse) {
        inTransaction("label training sample " + id, conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "UPDATE training_data SET user_response = ? WHERE id = ?")) {
                stmt.setInt(1, userResponse);
                stmt.setLong(2, id);
                stmt.executeUpdate();
            }
            return null;
        });
    }

    /** Labeled samples, newest first. */
    public List<TrainingSample> getLabeledTrainingSamples(int limit) {
        return inTransaction("read training samples", conn -> {
            List<TrainingSample> samples = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT * FROM training_data WHERE user_response IS NOT NULL ORDER BY timestamp DESC, id DESC LIMIT ?")) {
                stmt.setInt(1, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        samples.add(new TrainingSample(
                            rs.getLong("id"),
                            rs.getLong("timestamp"),
                            rs.getDouble("mouse_velocity"),
                            rs.getInt("keys_per_minute"),
                            AppCategory.fromLabel(rs.getString("app_category")),
                            rs.getLong("time_since_last_break"),
                            rs.getInt("is_fullscreen") != 0,
                            rs.getInt("user_response")
                        ));
                    }
                }
            }
            return samples;
        });
    }

    /**
     * @return counts of {total, labeled, completed (1), dismissed (0)}
     */
    public int[] getTrainingCounts() {
        return inTransaction("count training samples", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT COUNT(*), COUNT(user_response), " +
                    "COALESCE(SUM(CASE WHEN user_response = 1 THEN 1 ELSE 0 END), 0), " +
                    "COALESCE(SUM(CASE WHEN user_response = 0 THEN 1 ELSE 0 END), 0) FROM training_data");
                 ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return new int[] {rs.getInt(1), rs.getInt(2), rs.getInt(3), rs.getInt(4)};
            }
        });
    }

    // ---- engine checkpoint ----

    public void saveCheckpoint(String json) {
        inTransaction("write engine checkpoint", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement(
                "INSERT INTO engine_state (key, value, updated_at) VALUES (?, ?, ?) " +
                    "ON CONFLICT(key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at")) {
                stmt.setString(1, CHECKPOINT_KEY);
                stmt.setString(2, json);
                stmt.setLong(3, nowSeconds());
                stmt.executeUpdate();
            }
            return null;
        });
    }

    public Optional<String> loadCheckpoint() {
        return inTransaction("read engine checkpoint", conn -> {
            try (PreparedStatement stmt = conn.prepareStatement("SELECT value FROM engine_state WHERE key = ?")) {
                stmt.setString(1, CHECKPOINT_KEY);
                try (ResultSet rs = stmt.executeQuery()) {
                    return rs.next() ? Optional.of(rs.getString(1)) : Optional.<String>empty();
                }
            }
        });
    }

    // ---- plumbing ----

    long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    long startOfToday() {
        return LocalDate.now(clock).atStartOfDay(clock.getZone()).toEpochSecond();
    }

    private static long lastInsertId(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
            return rs.next() ? rs.getLong(1) : -1L;
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String what, SqlWork<T> work) {
        try (Connection conn = DriverManager.getConnection(url)) {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Store failure ({}): {}", what, e.getMessage());
            throw new StorageException("Failed to " + what + ": " + e.getMessage(), e);
        }
    }
}
