package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory feed connection. Records calls and lets tests push connection signals.
 */
class FakeFeedConnection implements FeedConnection {

    final List<List<Long>> connects = new CopyOnWriteArrayList<>();
    final List<List<Long>> subscriptions = new CopyOnWriteArrayList<>();
    final AtomicInteger closeCount = new AtomicInteger();

    private volatile FeedListener listener;
    private volatile boolean connectOnConnect = false;
    private volatile RuntimeException closeFailure;
    private volatile RuntimeException subscribeFailure;
    volatile long decodeErrors;
    volatile long rejectedTicks;

    /**
     * Makes every connect call report success immediately.
     */
    FakeFeedConnection autoConnect() {
        this.connectOnConnect = true;
        return this;
    }

    FakeFeedConnection failOnClose(RuntimeException failure) {
        this.closeFailure = failure;
        return this;
    }

    /**
     * Makes every subscribe call throw after it is recorded.
     */
    FakeFeedConnection failOnSubscribe(RuntimeException failure) {
        this.subscribeFailure = failure;
        return this;
    }

    @Override
    public void setListener(FeedListener listener) {
        this.listener = listener;
    }

    @Override
    public void connect(List<Long> tokens) {
        connects.add(new ArrayList<>(tokens));
        if (connectOnConnect) {
            listener.onConnect();
        }
    }

    @Override
    public void subscribeFull(List<Long> tokens) {
        subscriptions.add(new ArrayList<>(tokens));
        if (subscribeFailure != null) {
            throw subscribeFailure;
        }
    }

    @Override
    public long getDecodeErrors() {
        return decodeErrors;
    }

    @Override
    public long getRejectedTicks() {
        return rejectedTicks;
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        if (closeFailure != null) {
            throw closeFailure;
        }
    }

    void fireConnect() {
        listener.onConnect();
    }

    void fireTicks(Tick... ticks) {
        listener.onTicks(List.of(ticks));
    }

    void fireClose(int code, String reason) {
        listener.onClose(code, reason);
    }

    void fireError(int code, String reason) {
        listener.onError(code, reason);
    }

    FeedListener getListener() {
        return listener;
    }
}
