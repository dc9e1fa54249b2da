package io.trading.optionchain.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.optionchain.core.CycleObserver;
import io.trading.optionchain.core.SamplerStats;
import io.trading.optionchain.feed.OrchestratorStats;
import io.trading.optionchain.feed.ShardExhaustedException;
import io.trading.optionchain.feed.ShardListener;
import io.trading.optionchain.feed.ShardState;
import io.trading.optionchain.persistence.WriterStats;

import java.util.Map;

/**
 * Prometheus metrics collector for the option chain recorder.
 *
 * Tracks:
 * - Ticks received and reconnects across shards
 * - Shard state per shard
 * - Sampling cycles, rows produced and cycle duration
 * - Rows written and buffered per underlying
 * - Decode errors, rejected and malformed ticks, skipped contracts
 */
public class RecorderMetrics implements CycleObserver, ShardListener {

    private final CollectorRegistry registry;

    // Counters
    private final Counter reconnectAttempts;
    private final Counter shardsExhausted;
    private final Counter cycles;
    private final Counter failedCycles;
    private final Counter rowsProduced;

    // Gauges
    private final Gauge ticksReceived;
    private final Gauge shardState;
    private final Gauge rowsWritten;
    private final Gauge rowsBuffered;
    private final Gauge rowsDropped;
    private final Gauge decodeErrors;
    private final Gauge rejectedTicks;
    private final Gauge malformedTicks;
    private final Gauge skippedContracts;

    // Summary (cycle duration)
    private final Summary cycleDuration;

    public RecorderMetrics() {
        this(CollectorRegistry.defaultRegistry, true);
    }

    /**
     * @param registry   Registry to register the collectors in
     * @param jvmMetrics Whether to also register the default JVM collectors
     */
    public RecorderMetrics(CollectorRegistry registry, boolean jvmMetrics) {
        this.registry = registry;
        if (jvmMetrics) {
            DefaultExports.register(registry);
        }

        this.reconnectAttempts = Counter.build()
            .name("recorder_reconnect_attempts_total")
            .help("Total number of scheduled reconnect attempts")
            .labelNames("shard")
            .register(registry);

        this.shardsExhausted = Counter.build()
            .name("recorder_shards_exhausted_total")
            .help("Total number of shards that gave up reconnecting")
            .register(registry);

        this.cycles = Counter.build()
            .name("recorder_sampling_cycles_total")
            .help("Total number of completed sampling cycles")
            .register(registry);

        this.failedCycles = Counter.build()
            .name("recorder_sampling_failures_total")
            .help("Total number of sampling cycles abandoned after an error")
            .register(registry);

        this.rowsProduced = Counter.build()
            .name("recorder_rows_produced_total")
            .help("Total number of rows handed to the writers")
            .register(registry);

        this.ticksReceived = Gauge.build()
            .name("recorder_ticks_received")
            .help("Ticks received by the current shards")
            .register(registry);

        // Ordinal of ShardState
        this.shardState = Gauge.build()
            .name("recorder_shard_state")
            .help("Shard state (0 = DISCONNECTED ... 7 = STOPPED)")
            .labelNames("shard")
            .register(registry);

        this.rowsWritten = Gauge.build()
            .name("recorder_rows_written")
            .help("Rows written to disk per underlying")
            .labelNames("underlying")
            .register(registry);

        this.rowsBuffered = Gauge.build()
            .name("recorder_rows_buffered")
            .help("Rows waiting in the writer buffer per underlying")
            .labelNames("underlying")
            .register(registry);

        this.rowsDropped = Gauge.build()
            .name("recorder_rows_dropped")
            .help("Rows discarded by failed flushes per underlying")
            .labelNames("underlying")
            .register(registry);

        this.decodeErrors = Gauge.build()
            .name("recorder_decode_errors")
            .help("Feed frames that could not be decoded by the current shards")
            .register(registry);

        this.rejectedTicks = Gauge.build()
            .name("recorder_rejected_ticks")
            .help("Decoded ticks rejected by validation in the current shards")
            .register(registry);

        this.malformedTicks = Gauge.build()
            .name("recorder_malformed_ticks")
            .help("Cached ticks that could not be converted to rows")
            .register(registry);

        this.skippedContracts = Gauge.build()
            .name("recorder_skipped_contracts")
            .help("Contracts left out of snapshots for lack of a usable tick")
            .register(registry);

        this.cycleDuration = Summary.build()
            .name("recorder_cycle_duration_milliseconds")
            .help("Sampling cycle duration in milliseconds")
            .quantile(0.5, 0.05)
            .quantile(0.99, 0.001)
            .register(registry);
    }

    @Override
    public void onCycle(int rows, long durationMicros) {
        cycles.inc();
        rowsProduced.inc(rows);
        cycleDuration.observe(durationMicros / 1000.0);
    }

    @Override
    public void onCycleFailed() {
        failedCycles.inc();
    }

    @Override
    public void onReconnectAttempt(String shardName, int attempt, long delayMs) {
        reconnectAttempts.labels(shardName).inc();
    }

    @Override
    public void onShardExhausted(String shardName, ShardExhaustedException cause) {
        shardsExhausted.inc();
        shardState.labels(shardName).set(ShardState.EXHAUSTED.ordinal());
    }

    /**
     * Copies point-in-time feed, sampler and writer statistics into the gauges.
     */
    public void updateSnapshot(
        OrchestratorStats feed,
        SamplerStats sampler,
        Map<String, ShardState> shards,
        Map<String, WriterStats> writers
    ) {
        ticksReceived.set(feed.ticksReceived());
        decodeErrors.set(feed.decodeErrors());
        rejectedTicks.set(feed.rejectedTicks());
        malformedTicks.set(sampler.malformedTicks());
        skippedContracts.set(sampler.skippedContracts());
        shards.forEach((name, state) -> shardState.labels(name).set(state.ordinal()));
        writers.forEach((underlying, stats) -> {
            rowsWritten.labels(underlying).set(stats.rowsWritten());
            rowsBuffered.labels(underlying).set(stats.bufferSize());
            rowsDropped.labels(underlying).set(stats.droppedRows());
        });
    }

    public double getCycles() {
        return cycles.get();
    }

    public double getRowsProduced() {
        return rowsProduced.get();
    }

    public double getFailedCycles() {
        return failedCycles.get();
    }

    public double getReconnectAttempts(String shardName) {
        return reconnectAttempts.labels(shardName).get();
    }

    public double getShardsExhausted() {
        return shardsExhausted.get();
    }

    /**
     * Returns the CollectorRegistry for HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
