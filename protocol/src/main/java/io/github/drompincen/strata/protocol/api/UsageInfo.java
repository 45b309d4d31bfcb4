package io.github.drompincen.strata.protocol.api;

public record UsageInfo(
        int inputTokens,
        int outputTokens,
        int cacheReadTokens,
        int cacheCreationTokens,
        double costUsd,
        long durationMs,
        int contextTokens
) {
    public static UsageInfo empty() {
        return new UsageInfo(0, 0, 0, 0, 0, 0, 0);
    }

    public int totalInputTokens() {
        return inputTokens + cacheReadTokens + cacheCreationTokens;
    }
}
