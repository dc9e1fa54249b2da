package io.trading.optionchain.feed;

/**
 * Connection state of a feed shard.
 */
public enum ShardState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR,
    CLOSED,
    RECONNECTING,
    /** Reconnect attempts used up; the shard no longer delivers ticks. */
    EXHAUSTED,
    /** Stopped on request. */
    STOPPED;

    /**
     * Returns true for states the shard never leaves.
     */
    public boolean isTerminal() {
        return this == EXHAUSTED || this == STOPPED;
    }
}
