package io.trading.optionchain.feed;

/**
 * A shard used up its reconnect budget. Coverage for its tokens is lost until the
 * universe is rebuilt; other shards are unaffected.
 */
public class ShardExhaustedException extends RuntimeException {

    private final String shardName;
    private final int tokenCount;
    private final int attempts;

    public ShardExhaustedException(String shardName, int tokenCount, int attempts) {
        super(shardName + " exhausted after " + attempts + " reconnect attempts, "
            + tokenCount + " tokens without coverage");
        this.shardName = shardName;
        this.tokenCount = tokenCount;
        this.attempts = attempts;
    }

    public String getShardName() {
        return shardName;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public int getAttempts() {
        return attempts;
    }
}
