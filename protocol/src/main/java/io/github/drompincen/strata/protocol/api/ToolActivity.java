package io.github.drompincen.strata.protocol.api;

/**
 * One tool invocation as it appears in the transcript.
 *
 * @param summary one-line description used as the tool message text
 * @param detail optional secondary line (e.g. "2 added, 1 removed"), may be null
 */
public record ToolActivity(
        String toolName,
        ToolInput input,
        ToolOutput output,
        String summary,
        String detail
) {}
