package io.trading.optionchain.feed;

/**
 * Feed statistics summed across shards.
 */
public record OrchestratorStats(
    long ticksReceived,
    long reconnectCount,
    long errorCount,
    int shardCount,
    long decodeErrors,
    long rejectedTicks
) {
}
