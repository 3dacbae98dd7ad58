package com.aura.edge.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Activity feature vector captured when a break fires, later labeled with the user's answer.
 *
 * @param timeSinceLastBreak seconds since the last completed break
 * @param userResponse       1 completed, 0 snoozed or skipped, {@code null} while unanswered
 */
@JsonPropertyOrder({"id", "timestamp", "mouse_velocity", "keys_per_min", "app_category",
    "time_since_last_break", "is_fullscreen", "user_response"})
public record TrainingSample(
    long id,
    long timestamp,
    double mouseVelocity,
    @JsonProperty("keys_per_min") int keysPerMinute,
    @JsonIgnore AppCategory appCategory,
    long timeSinceLastBreak,
    @JsonProperty("is_fullscreen") boolean fullscreen,
    Integer userResponse
) {
    public static final int COMPLETED = 1;
    public static final int DISMISSED = 0;

    @JsonProperty("app_category")
    public String appCategoryLabel() {
        return appCategory.label();
    }
}
