package com.aura.shared.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An engine event: a {@code type} tag and an optional payload from {@link Payloads}.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Event {
    private EventType type;
    private Object data;

    public static Event of(EventType type) {
        return new Event(type, null);
    }

    public static Event of(EventType type, Object data) {
        return new Event(type, data);
    }

    public <T> T dataAs(Class<T> payloadType) {
        return payloadType.cast(data);
    }
}
