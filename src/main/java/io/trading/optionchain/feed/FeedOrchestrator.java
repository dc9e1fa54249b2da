package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shards the subscribed universe across feed connections and fans every shard's ticks
 * into one {@link LatestTickCache}.
 *
 * <p>Lifecycle: {@link #configure(List)} builds the shards, {@link #start()} opens them and
 * {@link #stop()} closes them. Reconfiguring while started stops the running shards first.
 */
public class FeedOrchestrator implements TickSource, ShardListener, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedOrchestrator.class);

    private final FeedConnectionFactory connectionFactory;
    private final ReconnectPolicy policyTemplate;
    private final ShardListener externalListener;
    private final int maxTokensPerConnection;
    private final int maxConnections;
    private final LatestTickCache cache = new LatestTickCache();

    private volatile List<FeedShard> shards = List.of();
    private boolean started = false;

    public FeedOrchestrator(FeedConnectionFactory connectionFactory, ReconnectPolicy policyTemplate) {
        this(connectionFactory, policyTemplate, null);
    }

    public FeedOrchestrator(
        FeedConnectionFactory connectionFactory,
        ReconnectPolicy policyTemplate,
        ShardListener externalListener
    ) {
        this(connectionFactory, policyTemplate, externalListener,
            ShardPlan.MAX_TOKENS_PER_CONNECTION, ShardPlan.MAX_CONNECTIONS);
    }

    FeedOrchestrator(
        FeedConnectionFactory connectionFactory,
        ReconnectPolicy policyTemplate,
        ShardListener externalListener,
        int maxTokensPerConnection,
        int maxConnections
    ) {
        this.connectionFactory = connectionFactory;
        this.policyTemplate = policyTemplate;
        this.externalListener = externalListener;
        this.maxTokensPerConnection = maxTokensPerConnection;
        this.maxConnections = maxConnections;
    }

    /**
     * Partitions the tokens into shards. Tokens beyond capacity are dropped and a warning is
     * logged; the returned plan records the truncation.
     *
     * @param tokens Tokens to subscribe, in priority order
     * @return The shard assignment
     */
    public synchronized ShardPlan configure(List<Long> tokens) {
        if (started) {
            LOGGER.info("[Orchestrator] Rebuilding universe, stopping {} running shards", shards.size());
            stop();
        }

        ShardPlan plan = ShardPlan.partition(tokens, maxTokensPerConnection, maxConnections);
        if (plan.truncated()) {
            LOGGER.warn("[Orchestrator] Subscription capacity exceeded: {} tokens requested, {} kept, {} dropped",
                plan.requestedTokens(), plan.assignedTokens(), plan.droppedTokens());
        }
        if (plan.duplicateTokens() > 0) {
            LOGGER.warn("[Orchestrator] Collapsed {} duplicate tokens", plan.duplicateTokens());
        }

        List<FeedShard> created = new ArrayList<>(plan.shardCount());
        for (int i = 0; i < plan.shardCount(); i++) {
            created.add(new FeedShard(
                i,
                plan.shards().get(i),
                connectionFactory.create(i),
                cache,
                policyTemplate.fresh(),
                this
            ));
        }
        cache.retainTokens(plan.allTokens());
        shards = Collections.unmodifiableList(created);

        LOGGER.info("[Orchestrator] Configured {} shards for {} tokens", plan.shardCount(), plan.assignedTokens());
        return plan;
    }

    /**
     * Opens every shard connection.
     */
    public synchronized void start() {
        if (started) {
            LOGGER.warn("[Orchestrator] Already started");
            return;
        }
        if (shards.isEmpty()) {
            LOGGER.warn("[Orchestrator] No shards configured, nothing to start");
        }
        for (FeedShard shard : shards) {
            shard.start();
        }
        started = true;
    }

    /**
     * Closes every shard. Failures on individual shards are logged and do not stop the others.
     */
    public synchronized void stop() {
        for (FeedShard shard : shards) {
            try {
                shard.stop();
            } catch (RuntimeException e) {
                LOGGER.warn("[Orchestrator] Error stopping {}: {}", shard.getName(), e.getMessage());
            }
        }
        started = false;
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public Map<Long, Tick> latestTicks() {
        return cache.snapshot();
    }

    @Override
    public boolean allShardsExhausted() {
        List<FeedShard> current = shards;
        if (current.isEmpty()) {
            return false;
        }
        for (FeedShard shard : current) {
            if (shard.getState() != ShardState.EXHAUSTED) {
                return false;
            }
        }
        return true;
    }

    /**
     * Statistics summed over the current shards.
     */
    public OrchestratorStats stats() {
        long ticks = 0;
        long reconnects = 0;
        long errors = 0;
        long decodeErrors = 0;
        long rejected = 0;
        List<FeedShard> current = shards;
        for (FeedShard shard : current) {
            ticks += shard.getTicksReceived();
            reconnects += shard.getReconnectCount();
            errors += shard.getErrorCount();
            decodeErrors += shard.getDecodeErrors();
            rejected += shard.getRejectedTicks();
        }
        return new OrchestratorStats(ticks, reconnects, errors, current.size(), decodeErrors, rejected);
    }

    /**
     * Current state per shard name, in shard order.
     */
    public Map<String, ShardState> shardStates() {
        Map<String, ShardState> states = new LinkedHashMap<>();
        for (FeedShard shard : shards) {
            states.put(shard.getName(), shard.getState());
        }
        return states;
    }

    public List<FeedShard> getShards() {
        return shards;
    }

    @Override
    public void onReconnectAttempt(String shardName, int attempt, long delayMs) {
        if (externalListener != null) {
            externalListener.onReconnectAttempt(shardName, attempt, delayMs);
        }
    }

    @Override
    public void onShardExhausted(String shardName, ShardExhaustedException cause) {
        LOGGER.error("[Orchestrator] {} lost, {} tokens without coverage", shardName, cause.getTokenCount());
        if (externalListener != null) {
            externalListener.onShardExhausted(shardName, cause);
        }
        if (allShardsExhausted()) {
            LOGGER.error("[Orchestrator] All shards exhausted");
        }
    }
}
