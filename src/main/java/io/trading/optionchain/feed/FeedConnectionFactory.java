package io.trading.optionchain.feed;

/**
 * Creates one feed connection per shard.
 */
@FunctionalInterface
public interface FeedConnectionFactory {

    /**
     * @param shardIndex Zero-based shard index, useful for naming
     */
    FeedConnection create(int shardIndex);
}
