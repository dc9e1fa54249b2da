package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;

import java.util.Map;

/**
 * Read side of the feed as seen by the sampler.
 */
public interface TickSource {

    /**
     * Point-in-time copy of the latest tick per token.
     */
    Map<Long, Tick> latestTicks();

    /**
     * True when no shard can deliver ticks any more.
     */
    boolean allShardsExhausted();
}
