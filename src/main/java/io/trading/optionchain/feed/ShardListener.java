package io.trading.optionchain.feed;

/**
 * Receives shard lifecycle events that matter outside the shard.
 */
public interface ShardListener {

    /**
     * Called before each reconnect attempt is scheduled.
     */
    default void onReconnectAttempt(String shardName, int attempt, long delayMs) {
    }

    /**
     * Called once when the shard gives up reconnecting.
     */
    void onShardExhausted(String shardName, ShardExhaustedException cause);
}
