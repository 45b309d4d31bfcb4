package io.github.drompincen.strata.protocol.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.strata.protocol.command.BridgeCommand;

/**
 * Serializes one command to one line of JSON (without the trailing newline).
 * The {@code type} tag is always the first field; null fields are left out.
 */
public class CommandEncoder {

    private final ObjectMapper mapper;

    public CommandEncoder() {
        this(BridgeJson.newMapper());
    }

    public CommandEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(BridgeCommand command) {
        ObjectNode line = mapper.createObjectNode();
        line.put("type", command.commandType().wireName());
        ObjectNode fields = mapper.valueToTree(command);
        line.setAll(fields);
        try {
            return mapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + command.commandType() + " command", e);
        }
    }
}
