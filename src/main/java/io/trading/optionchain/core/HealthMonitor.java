package io.trading.optionchain.core;

import io.trading.optionchain.feed.FeedOrchestrator;
import io.trading.optionchain.feed.OrchestratorStats;
import io.trading.optionchain.feed.ShardState;
import io.trading.optionchain.persistence.MultiCsvWriter;
import io.trading.optionchain.persistence.WriterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically checks shard connection states and writer backlogs and reports problems.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final long checkIntervalMs;
    private final FeedOrchestrator orchestrator;
    private final MultiCsvWriter writers;
    private final Supplier<SamplerStats> sampler;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Long> unhealthyChecks = new ConcurrentHashMap<>();

    private volatile boolean running = false;

    public HealthMonitor(
        long checkIntervalMs,
        FeedOrchestrator orchestrator,
        MultiCsvWriter writers,
        Supplier<SamplerStats> sampler
    ) {
        this.checkIntervalMs = checkIntervalMs;
        this.orchestrator = orchestrator;
        this.writers = writers;
        this.sampler = sampler;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    public void stop() {
        if (!running) {
            scheduler.shutdownNow();
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Runs one check. Shards not in CONNECTED state are reported and counted.
     *
     * @return number of unhealthy shards
     */
    int performHealthCheck() {
        int unhealthy = 0;
        try {
            for (Map.Entry<String, ShardState> entry : orchestrator.shardStates().entrySet()) {
                if (entry.getValue() != ShardState.CONNECTED) {
                    unhealthy++;
                    unhealthyChecks.merge(entry.getKey(), 1L, Long::sum);
                    LOGGER.warn("[HealthMonitor] {} is {}", entry.getKey(), entry.getValue());
                }
            }
            for (WriterStats stats : writers.stats().values()) {
                if (stats.failedFlushes() > 0) {
                    LOGGER.warn("[HealthMonitor] Writer {} has {} failed flushes, {} rows dropped",
                        stats.underlying(), stats.failedFlushes(), stats.droppedRows());
                }
            }
        } catch (RuntimeException e) {
            LOGGER.error("[HealthMonitor] Health check failed", e);
        }
        return unhealthy;
    }

    /**
     * Logs a summary of connection, data quality and writer statistics.
     */
    public void logSummary() {
        OrchestratorStats feed = orchestrator.stats();
        SamplerStats sampling = sampler.get();
        LOGGER.info("=== Health Monitor Summary ===");
        LOGGER.info("Feed: shards={}, ticks={}, reconnects={}, errors={}",
            feed.shardCount(), feed.ticksReceived(), feed.reconnectCount(), feed.errorCount());
        LOGGER.info("Data quality: decodeErrors={}, rejectedTicks={}, malformedTicks={}, skippedContracts={}",
            feed.decodeErrors(), feed.rejectedTicks(), sampling.malformedTicks(), sampling.skippedContracts());
        orchestrator.shardStates().forEach((name, state) ->
            LOGGER.info("{}: state={}, unhealthyChecks={}", name, state, unhealthyChecks.getOrDefault(name, 0L)));
        writers.stats().forEach((underlying, stats) ->
            LOGGER.info("{}: rows={}, flushes={}, failedFlushes={}, file={}",
                underlying, stats.rowsWritten(), stats.flushCount(), stats.failedFlushes(), stats.currentFile()));
        LOGGER.info("=============================");
    }

    public long getUnhealthyChecks(String shardName) {
        return unhealthyChecks.getOrDefault(shardName, 0L);
    }

    @Override
    public void close() {
        stop();
    }
}
