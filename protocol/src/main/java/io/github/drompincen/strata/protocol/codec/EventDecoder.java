package io.github.drompincen.strata.protocol.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.strata.protocol.api.UsageInfo;
import io.github.drompincen.strata.protocol.event.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps one line of bridge output to a typed {@link BridgeEvent}.
 * Returns empty for lines that are not a JSON object with a string {@code type},
 * or that lack the fields their tag requires. Unknown tags decode to {@link IgnoredEvent}.
 */
public class EventDecoder {

    private static final Logger log = LoggerFactory.getLogger(EventDecoder.class);
    private static final int LOG_PREVIEW = 200;

    private final ObjectMapper mapper;

    public EventDecoder() {
        this(BridgeJson.newMapper());
    }

    public EventDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<BridgeEvent> decode(String line) {
        JsonNode json;
        try {
            json = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Malformed JSON line: {}", preview(line));
            return Optional.empty();
        }
        if (json == null || !json.isObject() || !json.path("type").isTextual()) {
            log.debug("Line without a type tag: {}", preview(line));
            return Optional.empty();
        }

        String tag = json.get("type").asText();
        EventType type = EventType.fromWire(tag);
        BridgeEvent event = switch (type) {
            case READY -> new ReadyEvent(text(json, "nonce"));
            case TOKEN -> json.path("text").isTextual() ? new TokenEvent(json.get("text").asText()) : null;
            case SET_TEXT -> json.path("text").isTextual() ? new SetTextEvent(json.get("text").asText()) : null;
            case PERMISSION_REQUEST -> decodePermissionRequest(json);
            case RESULT -> decodeResult(json);
            case ERROR -> new ErrorEvent(json.path("message").isTextual()
                    ? json.get("message").asText() : "Unknown error");
            case TURN_COMPLETE -> TurnCompleteEvent.INSTANCE;
            case TOOL_ACTIVITY -> decodeToolActivity(json);
            case DEBUG -> new DebugEvent(json.path("message").asText(""));
            case TOOL_PROGRESS, TOOL_USE_SUMMARY, UNKNOWN -> new IgnoredEvent(type, tag);
        };
        if (event == null) {
            log.debug("Incomplete {} message: {}", tag, preview(line));
        }
        return Optional.ofNullable(event);
    }

    private PermissionRequestEvent decodePermissionRequest(JsonNode json) {
        String requestId = text(json, "requestId");
        String toolName = text(json, "toolName");
        if (requestId == null || toolName == null) return null;

        Map<String, String> summary = new LinkedHashMap<>();
        JsonNode input = json.path("input");
        if (input.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = input.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                summary.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return new PermissionRequestEvent(requestId, toolName, summary, text(json, "reason"));
    }

    private ResultEvent decodeResult(JsonNode json) {
        UsageInfo usage = null;
        JsonNode usageNode = json.path("usage");
        if (usageNode.isObject() || json.has("costUSD")) {
            usage = new UsageInfo(
                    usageNode.path("inputTokens").asInt(0),
                    usageNode.path("outputTokens").asInt(0),
                    usageNode.path("cacheReadTokens").asInt(0),
                    usageNode.path("cacheCreationTokens").asInt(0),
                    json.path("costUSD").asDouble(0),
                    json.path("durationMs").asLong(0),
                    json.path("contextTokens").asInt(0));
        }
        return new ResultEvent(json.path("text").asText(""), text(json, "sessionId"), usage);
    }

    private ToolActivityEvent decodeToolActivity(JsonNode json) {
        String toolName = json.path("toolName").isTextual() ? json.get("toolName").asText() : "Unknown";
        JsonNode input = json.path("input");
        ObjectNode inputObject = input.isObject() ? (ObjectNode) input : mapper.createObjectNode();
        JsonNode result = json.get("result");
        return new ToolActivityEvent(toolName, inputObject, result);
    }

    private static String text(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static String preview(String line) {
        return line.length() <= LOG_PREVIEW ? line : line.substring(0, LOG_PREVIEW);
    }
}
