package io.trading.optionchain.core;

import io.trading.optionchain.config.RecorderConfig;
import io.trading.optionchain.feed.FeedConnectionFactory;
import io.trading.optionchain.feed.FeedOrchestrator;
import io.trading.optionchain.feed.ReconnectPolicy;
import io.trading.optionchain.feed.ShardPlan;
import io.trading.optionchain.metrics.MetricsServer;
import io.trading.optionchain.metrics.RecorderMetrics;
import io.trading.optionchain.metrics.RecorderStatus;
import io.trading.optionchain.model.ContractMeta;
import io.trading.optionchain.persistence.MultiCsvWriter;
import io.trading.optionchain.snapshot.SnapshotBuilder;
import io.trading.optionchain.snapshot.SpotPriceBook;
import io.trading.optionchain.snapshot.TimestampConverter;
import io.trading.optionchain.upstream.InstrumentProvider;
import org.agrona.CloseHelper;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main controller for one recording session.
 * Wires the feed orchestrator, row builder, writers and sampling loop, and owns their shutdown.
 */
public class RecorderController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecorderController.class);

    private final RecorderConfig config;
    private final InstrumentProvider instruments;
    private final SpotPriceBook spots;
    private final EpochClock clock;
    private final RecorderMetrics metrics;

    private final FeedOrchestrator orchestrator;
    private final MultiCsvWriter writers;
    private final SamplingScheduler scheduler;
    private final HealthMonitor healthMonitor;
    private final MetricsServer metricsServer;

    private final AtomicReference<Map<Long, ContractMeta>> universe = new AtomicReference<>(Map.of());
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final long startTime;
    private volatile boolean started = false;

    /**
     * @param config       Recorder configuration
     * @param feedFactory  Creates one feed connection per shard
     * @param instruments  Source of the universe and seed spot prices
     * @param spots        Spot book shared with the instrument provider
     * @param clock        Wall clock for sampling cadence and file dates
     * @param metrics      Metrics collector, or null to run without metrics and HTTP server
     */
    public RecorderController(
        RecorderConfig config,
        FeedConnectionFactory feedFactory,
        InstrumentProvider instruments,
        SpotPriceBook spots,
        EpochClock clock,
        RecorderMetrics metrics
    ) {
        this.config = config;
        this.instruments = instruments;
        this.spots = spots;
        this.clock = clock;
        this.metrics = metrics;

        this.orchestrator = new FeedOrchestrator(
            feedFactory,
            ReconnectPolicy.ofSeconds(config.reconnectMaxDelaySeconds(), config.reconnectMaxTries()),
            metrics
        );
        this.writers = new MultiCsvWriter(
            config.outputDir(),
            config.underlyings(),
            config.fileVenueToken(),
            config.flushRowsPerWrite(),
            config.flushIntervalMillis(),
            clock,
            config.timezone()
        );
        SnapshotBuilder builder = new SnapshotBuilder(config.venueLabel(), new TimestampConverter(config.timezone()));
        this.scheduler = new SamplingScheduler(
            orchestrator,
            builder,
            writers,
            universe::get,
            spots,
            config.spotTokens(),
            config.samplingIntervalMillis(),
            clock,
            metrics == null ? CycleObserver.NONE : new MetricsCycleObserver()
        );
        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), orchestrator, writers, scheduler::stats);
        this.metricsServer = metrics != null && config.metricsPort() > 0
            ? new MetricsServer(config.metricsPort(), metrics, this::status)
            : null;
        this.startTime = clock.time();

        LOGGER.info("Recorder controller initialized: underlyings={}, venue={}",
            config.underlyings(), config.venueLabel());
    }

    /**
     * Seeds spot prices, subscribes the universe and starts the monitors.
     *
     * @throws IOException if the metrics server cannot bind its port
     */
    public void start() throws IOException {
        LOGGER.info("Starting option chain recorder...");

        Map<String, Double> seeds = instruments.spotPrices(config.underlyings());
        spots.updateAll(seeds);
        LOGGER.info("Seed spot prices: {}", spots.snapshot());

        rebuildUniverse();
        orchestrator.start();
        started = true;

        healthMonitor.start();
        if (metricsServer != null) {
            metricsServer.start();
        }

        LOGGER.info("Option chain recorder started");
    }

    /**
     * Reloads the universe from the instrument provider and re-shards the feed.
     * Index tokens go first so capacity truncation never drops them.
     *
     * @return The new shard assignment
     */
    public synchronized ShardPlan rebuildUniverse() {
        Map<Long, ContractMeta> contracts = instruments.universe(config.underlyings());
        if (contracts.isEmpty()) {
            LOGGER.warn("Universe is empty for {}", config.underlyings());
        }

        List<Long> tokens = new ArrayList<>(config.spotTokens().size() + contracts.size());
        tokens.addAll(config.spotTokens().values());
        tokens.addAll(contracts.keySet());

        boolean restart = started;
        ShardPlan plan = orchestrator.configure(tokens);
        universe.set(Collections.unmodifiableMap(contracts));
        if (restart) {
            orchestrator.start();
        }

        LOGGER.info("Universe loaded: {} contracts, {} tokens subscribed over {} shards",
            contracts.size(), plan.assignedTokens(), plan.shardCount());
        return plan;
    }

    /**
     * Runs the sampling loop on the calling thread until the deadline passes or
     * {@link #requestStop()} is called.
     *
     * @param deadlineMillis Epoch millis at which the session ends
     */
    public void runSession(long deadlineMillis) {
        scheduler.setDeadline(deadlineMillis);
        scheduler.run();
    }

    /**
     * Asks the sampling loop to end. Safe to call from any thread.
     */
    public void requestStop() {
        scheduler.stop();
    }

    /**
     * Stops the loop and the feed, then flushes and closes every writer.
     * Writers are closed before any statistics are gathered, even if stopping the feed fails.
     * Later calls do nothing.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutting down option chain recorder...");

        scheduler.stop();
        try {
            orchestrator.stop();
        } catch (RuntimeException e) {
            LOGGER.warn("Error stopping feed orchestrator: {}", e.getMessage());
        } finally {
            writers.close();
        }
        CloseHelper.closeAll(healthMonitor, metricsServer);

        try {
            healthMonitor.logSummary();
            LOGGER.info("Final feed stats: {}", orchestrator.stats());
            LOGGER.info("Final sampler stats: {}", scheduler.stats());
            writers.stats().forEach((underlying, stats) -> LOGGER.info("Final writer stats {}: {}", underlying, stats));
        } catch (RuntimeException e) {
            LOGGER.warn("Could not report final statistics: {}", e.getMessage());
        }
        LOGGER.info("Option chain recorder shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    public RecorderStatus status() {
        return new RecorderStatus(
            config.venueLabel(),
            clock.time() - startTime,
            orchestrator.stats(),
            orchestrator.shardStates(),
            scheduler.stats(),
            writers.stats()
        );
    }

    public Map<Long, ContractMeta> getUniverse() {
        return universe.get();
    }

    public FeedOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public MultiCsvWriter getWriters() {
        return writers;
    }

    SamplingScheduler getScheduler() {
        return scheduler;
    }

    /**
     * Forwards cycle results to the metrics and refreshes the point-in-time gauges.
     */
    private final class MetricsCycleObserver implements CycleObserver {

        @Override
        public void onCycle(int rows, long durationMicros) {
            metrics.onCycle(rows, durationMicros);
            metrics.updateSnapshot(orchestrator.stats(), scheduler.stats(), orchestrator.shardStates(), writers.stats());
        }

        @Override
        public void onCycleFailed() {
            metrics.onCycleFailed();
        }
    }
}
