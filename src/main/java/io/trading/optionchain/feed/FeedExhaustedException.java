package io.trading.optionchain.feed;

/**
 * Every shard of the orchestrator is exhausted; no ticks can arrive any more.
 */
public class FeedExhaustedException extends RuntimeException {

    public FeedExhaustedException(String message) {
        super(message);
    }
}
