package com.aura.edge.gateway;

import com.aura.shared.protocol.Command;
import com.aura.shared.protocol.Event;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON encoding for the host protocol. One shared {@link ObjectMapper} configuration is
 * used for the wire, the checkpoint document and stored rule day lists.
 */
public final class ProtocolMapper {

    private ProtocolMapper() {
    }

    public static ObjectMapper create() {
        return new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    /**
     * @throws CommandRejectedException when the line is not a JSON object with a {@code cmd} field
     */
    public static Command readCommand(ObjectMapper mapper, String line) {
        JsonNode node;
        try {
            node = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new CommandRejectedException("Invalid JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new CommandRejectedException("Invalid JSON: expected an object");
        }
        if (!node.hasNonNull("cmd")) {
            throw new CommandRejectedException("Missing 'cmd' field");
        }
        try {
            return mapper.treeToValue(node, Command.class);
        } catch (JsonProcessingException e) {
            throw new CommandRejectedException("Invalid command arguments: " + e.getOriginalMessage());
        }
    }

    public static String writeEvent(ObjectMapper mapper, Event event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode event " + event.getType(), e);
        }
    }
}
