package io.trading.optionchain.feed;

import java.util.List;

/**
 * One logical streaming session to the market data feed.
 * Implementations deliver already decoded ticks and connection signals to the listener;
 * they do not reconnect on their own.
 */
public interface FeedConnection extends AutoCloseable {

    /**
     * Sets the listener that receives ticks and connection signals.
     */
    void setListener(FeedListener listener);

    /**
     * Opens the session for the given tokens. Failures are reported through
     * {@link FeedListener#onError} rather than thrown where possible.
     *
     * @param tokens Tokens this session will carry
     */
    void connect(List<Long> tokens);

    /**
     * Subscribes the tokens in full (depth) mode. Must be repeated after every connect.
     */
    void subscribeFull(List<Long> tokens);

    /**
     * Frames that could not be decoded since this connection was created.
     */
    default long getDecodeErrors() {
        return 0;
    }

    /**
     * Decoded ticks dropped for failing validation since this connection was created.
     */
    default long getRejectedTicks() {
        return 0;
    }

    /**
     * Closes the session. Safe to call on an already closed connection.
     */
    @Override
    void close();
}
