package io.github.drompincen.strata.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.strata.protocol.api.ToolActivity;
import io.github.drompincen.strata.protocol.api.ToolInput;
import io.github.drompincen.strata.protocol.api.ToolOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps tool names to their {@link ToolResultInterpreter}. Interpreters come from
 * {@link ServiceLoader}; names nobody claims fall back to {@link PassthroughInterpreter}.
 */
public class ToolInterpreterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolInterpreterRegistry.class);

    private final Map<String, ToolResultInterpreter> interpreters = new ConcurrentHashMap<>();
    private final ToolResultInterpreter fallback = new PassthroughInterpreter();

    public static ToolInterpreterRegistry loadDefault() {
        ToolInterpreterRegistry registry = new ToolInterpreterRegistry();
        registry.loadInterpreters();
        return registry;
    }

    public void loadInterpreters() {
        ServiceLoader<ToolResultInterpreter> loader = ServiceLoader.load(ToolResultInterpreter.class);
        for (ToolResultInterpreter interpreter : loader) {
            register(interpreter);
        }
        log.info("Loaded interpreters for {} tools via SPI", interpreters.size());
    }

    public void register(ToolResultInterpreter interpreter) {
        for (String name : interpreter.toolNames()) {
            interpreters.put(name, interpreter);
            log.debug("Registered interpreter {} for tool {}", interpreter.getClass().getSimpleName(), name);
        }
    }

    public Optional<ToolResultInterpreter> get(String toolName) {
        return Optional.ofNullable(interpreters.get(toolName));
    }

    public Collection<String> toolNames() {
        return Collections.unmodifiableSet(interpreters.keySet());
    }

    /**
     * Builds the transcript view of one tool invocation. A plain string result is taken as
     * stdout whatever the tool; other payloads go to the tool's interpreter.
     */
    public ToolActivity interpret(String toolName, JsonNode input, JsonNode result) {
        ToolResultInterpreter interpreter = get(toolName).orElse(fallback);
        ToolInput toolInput = ToolInputParser.parse(input);

        ToolOutput output;
        if (result != null && result.isTextual()) {
            output = ToolOutput.ofStdout(result.asText());
        } else {
            output = interpreter.interpret(toolInput, ToolInputParser.orNull(result));
        }

        return new ToolActivity(
                toolName,
                toolInput,
                output,
                interpreter.summarize(toolName, toolInput, output),
                interpreter.detail(toolInput, output));
    }
}
