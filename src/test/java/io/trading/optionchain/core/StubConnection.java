package io.trading.optionchain.core;

import io.trading.optionchain.feed.FeedConnection;
import io.trading.optionchain.feed.FeedListener;
import io.trading.optionchain.model.Tick;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Feed connection that reports success on connect and lets tests push ticks.
 */
class StubConnection implements FeedConnection {

    final List<List<Long>> connects = new CopyOnWriteArrayList<>();
    final List<List<Long>> subscriptions = new CopyOnWriteArrayList<>();
    final AtomicInteger closeCount = new AtomicInteger();
    private final boolean connectSucceeds;
    private volatile FeedListener listener;
    private volatile RuntimeException statsFailure;

    StubConnection(boolean connectSucceeds) {
        this.connectSucceeds = connectSucceeds;
    }

    @Override
    public void setListener(FeedListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect(List<Long> tokens) {
        connects.add(new ArrayList<>(tokens));
        if (connectSucceeds) {
            listener.onConnect();
        }
    }

    @Override
    public void subscribeFull(List<Long> tokens) {
        subscriptions.add(new ArrayList<>(tokens));
    }

    @Override
    public long getDecodeErrors() {
        if (statsFailure != null) {
            throw statsFailure;
        }
        return 0;
    }

    /**
     * Makes every later statistics read throw.
     */
    void failStats(RuntimeException failure) {
        this.statsFailure = failure;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    void push(Tick... ticks) {
        listener.onTicks(List.of(ticks));
    }
}
