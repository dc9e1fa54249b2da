package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;

import java.util.List;

/**
 * Raw signals delivered by a {@link FeedConnection}.
 * Reconnect decisions are not made here; the owning shard reacts to these signals.
 */
public interface FeedListener {

    /**
     * Called when the session is established and ready for subscriptions.
     */
    void onConnect();

    /**
     * Called with a batch of decoded ticks.
     */
    void onTicks(List<Tick> ticks);

    /**
     * Called when the session is closed, by either side.
     */
    void onClose(int code, String reason);

    /**
     * Called on a transport or protocol error.
     */
    void onError(int code, String reason);
}
