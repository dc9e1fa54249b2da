package io.trading.optionchain.metrics;

import io.trading.optionchain.core.SamplerStats;
import io.trading.optionchain.feed.OrchestratorStats;
import io.trading.optionchain.feed.ShardState;
import io.trading.optionchain.persistence.WriterStats;

import java.util.Map;

/**
 * Point-in-time view of a running recorder session, served by the status endpoint.
 */
public record RecorderStatus(
    String venue,
    long uptimeMs,
    OrchestratorStats feed,
    Map<String, ShardState> shards,
    SamplerStats sampler,
    Map<String, WriterStats> writers
) {

    /**
     * Healthy while at least one shard is connected.
     */
    public boolean healthy() {
        return shards.containsValue(ShardState.CONNECTED);
    }
}
