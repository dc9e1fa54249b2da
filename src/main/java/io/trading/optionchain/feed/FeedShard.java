package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One feed connection and the disjoint token subset it carries.
 * Owns the reconnect state machine: connection signals move the shard between states, and
 * every entry into {@link ShardState#CONNECTED} re-subscribes the tokens in full mode.
 */
public class FeedShard implements FeedListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedShard.class);

    private final String name;
    private final List<Long> tokens;
    private final FeedConnection connection;
    private final LatestTickCache cache;
    private final ReconnectPolicy policy;
    private final ShardListener shardListener;
    private final ScheduledExecutorService reconnectExecutor;

    private final Object stateLock = new Object();
    private volatile ShardState state = ShardState.DISCONNECTED;
    private volatile boolean stopped = false;

    private final AtomicLong ticksReceived = new AtomicLong(0);
    private final AtomicLong reconnectCount = new AtomicLong(0);
    private final AtomicLong errorCount = new AtomicLong(0);

    public FeedShard(
        int index,
        List<Long> tokens,
        FeedConnection connection,
        LatestTickCache cache,
        ReconnectPolicy policy,
        ShardListener shardListener
    ) {
        this.name = "Shard-" + (index + 1);
        this.tokens = List.copyOf(tokens);
        this.connection = connection;
        this.cache = cache;
        this.policy = policy;
        this.shardListener = shardListener;
        this.reconnectExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reconnect-" + name.toLowerCase());
            t.setDaemon(true);
            return t;
        });
        this.connection.setListener(this);
    }

    /**
     * Opens the connection. Subscription happens when the connection reports it is up.
     */
    public void start() {
        synchronized (stateLock) {
            if (stopped || state != ShardState.DISCONNECTED) {
                LOGGER.warn("[{}] Start ignored in state {}", name, state);
                return;
            }
            state = ShardState.CONNECTING;
        }
        LOGGER.info("[{}] Connecting with {} tokens", name, tokens.size());
        openConnection();
    }

    /**
     * Stops the shard. Pending reconnects are cancelled and the connection is closed.
     * Calling it again has no effect.
     */
    public void stop() {
        synchronized (stateLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            state = ShardState.STOPPED;
        }
        reconnectExecutor.shutdownNow();
        try {
            connection.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Error while closing connection: {}", name, e.getMessage());
        }
        LOGGER.info("[{}] Stopped (ticks={}, reconnects={}, errors={})",
            name, ticksReceived.get(), reconnectCount.get(), errorCount.get());
    }

    @Override
    public void onConnect() {
        synchronized (stateLock) {
            if (stopped || state.isTerminal()) {
                return;
            }
            state = ShardState.CONNECTED;
        }
        policy.reset();
        LOGGER.info("[{}] Connected, subscribing {} tokens in full mode", name, tokens.size());
        try {
            connection.subscribeFull(tokens);
        } catch (RuntimeException e) {
            LOGGER.error("[{}] Subscribe failed: {}", name, e.getMessage());
            onError(-1, "subscribe failed: " + e.getMessage());
        }
    }

    @Override
    public void onTicks(List<Tick> ticks) {
        if (stopped || ticks == null) {
            return;
        }
        cache.putAll(ticks);
        ticksReceived.addAndGet(ticks.size());
    }

    @Override
    public void onClose(int code, String reason) {
        LOGGER.warn("[{}] Connection closed: {} {}", name, code, reason);
        handleDisconnect(ShardState.CLOSED);
    }

    @Override
    public void onError(int code, String reason) {
        errorCount.incrementAndGet();
        LOGGER.error("[{}] Connection error: {} {}", name, code, reason);
        handleDisconnect(ShardState.ERROR);
    }

    private void handleDisconnect(ShardState cause) {
        ShardExhaustedException exhausted = null;
        int attempt = 0;
        long delayMs = 0;
        synchronized (stateLock) {
            if (stopped || state.isTerminal() || state == ShardState.RECONNECTING) {
                return;
            }
            state = cause;
            if (!policy.shouldRetry()) {
                state = ShardState.EXHAUSTED;
                exhausted = new ShardExhaustedException(name, tokens.size(), policy.getAttemptCount());
            } else {
                delayMs = policy.nextDelayMs();
                attempt = policy.recordFailure();
                state = ShardState.RECONNECTING;
                reconnectCount.incrementAndGet();
                try {
                    reconnectExecutor.schedule(this::reconnect, delayMs, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    LOGGER.warn("[{}] Reconnect not scheduled, executor is shut down", name);
                    return;
                }
            }
        }

        if (exhausted != null) {
            LOGGER.error("[{}] {}", name, exhausted.getMessage());
            if (shardListener != null) {
                shardListener.onShardExhausted(name, exhausted);
            }
            return;
        }
        LOGGER.info("[{}] Reconnect attempt {}/{} in {} ms", name, attempt, policy.getMaxAttempts(), delayMs);
        if (shardListener != null) {
            shardListener.onReconnectAttempt(name, attempt, delayMs);
        }
    }

    private void reconnect() {
        synchronized (stateLock) {
            if (stopped || state != ShardState.RECONNECTING) {
                return;
            }
            state = ShardState.CONNECTING;
        }
        try {
            connection.close();
        } catch (RuntimeException e) {
            LOGGER.debug("[{}] Error closing previous session: {}", name, e.getMessage());
        }
        openConnection();
    }

    private void openConnection() {
        try {
            connection.connect(tokens);
        } catch (RuntimeException e) {
            onError(-1, "connect failed: " + e.getMessage());
        }
    }

    public String getName() {
        return name;
    }

    public List<Long> getTokens() {
        return tokens;
    }

    public ShardState getState() {
        return state;
    }

    public long getTicksReceived() {
        return ticksReceived.get();
    }

    public long getReconnectCount() {
        return reconnectCount.get();
    }

    public long getErrorCount() {
        return errorCount.get();
    }

    public long getDecodeErrors() {
        return connection.getDecodeErrors();
    }

    public long getRejectedTicks() {
        return connection.getRejectedTicks();
    }
}
