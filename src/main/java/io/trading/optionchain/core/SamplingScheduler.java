package io.trading.optionchain.core;

import io.trading.optionchain.feed.FeedExhaustedException;
import io.trading.optionchain.feed.TickSource;
import io.trading.optionchain.model.ContractMeta;
import io.trading.optionchain.model.SnapshotRow;
import io.trading.optionchain.model.Tick;
import io.trading.optionchain.persistence.MultiCsvWriter;
import io.trading.optionchain.snapshot.SnapshotBuilder;
import io.trading.optionchain.snapshot.SpotPriceBook;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Fixed-cadence sampling loop: pulls the latest ticks, builds one row per contract and hands
 * the rows to the writers.
 *
 * <p>Missed cycles are not caught up. When a cycle overruns, the next one fires immediately and
 * the cadence restarts from there. Every loop iteration also runs the writers' time-based flush
 * check. The loop sleeps in slices of at most {@value #MAX_SLEEP_MS} ms so a stop request is
 * honoured quickly.
 */
public class SamplingScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SamplingScheduler.class);

    static final long MAX_SLEEP_MS = 100;
    private static final int STATS_LOG_EVERY = 60;

    private final TickSource tickSource;
    private final SnapshotBuilder builder;
    private final MultiCsvWriter writers;
    private final Supplier<Map<Long, ContractMeta>> universe;
    private final SpotPriceBook spots;
    private final Map<String, Long> spotTokens;
    private final long intervalMillis;
    private final EpochClock clock;
    private final CycleObserver observer;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile long deadlineMillis = Long.MAX_VALUE;
    private long nextSnapshotTime;

    private volatile long snapshotsTaken = 0;
    private volatile long rowsProduced = 0;
    private volatile long failedCycles = 0;
    private volatile long lastSnapshotMillis = 0;

    public SamplingScheduler(
        TickSource tickSource,
        SnapshotBuilder builder,
        MultiCsvWriter writers,
        Supplier<Map<Long, ContractMeta>> universe,
        SpotPriceBook spots,
        Map<String, Long> spotTokens,
        long intervalMillis,
        EpochClock clock,
        CycleObserver observer
    ) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("intervalMillis must be positive: " + intervalMillis);
        }
        this.tickSource = tickSource;
        this.builder = builder;
        this.writers = writers;
        this.universe = universe;
        this.spots = spots;
        this.spotTokens = Map.copyOf(spotTokens);
        this.intervalMillis = intervalMillis;
        this.clock = clock;
        this.observer = observer == null ? CycleObserver.NONE : observer;
        this.nextSnapshotTime = clock.time() + intervalMillis;
    }

    /**
     * Runs the loop on the calling thread until {@link #stop()} is called or the session
     * deadline passes.
     *
     * @throws FeedExhaustedException when every feed shard has given up reconnecting
     */
    public void run() {
        LOGGER.info("[Sampler] Started, interval {} ms", intervalMillis);
        nextSnapshotTime = clock.time() + intervalMillis;
        try {
            while (!stopRequested.get()) {
                if (clock.time() >= deadlineMillis) {
                    LOGGER.info("[Sampler] Session deadline reached");
                    break;
                }
                iterate();
                if (tickSource.allShardsExhausted()) {
                    throw new FeedExhaustedException("All feed shards exhausted, no ticks can arrive");
                }
                pause();
            }
        } finally {
            LOGGER.info("[Sampler] Stopped: {}", stats());
        }
    }

    /**
     * One loop iteration without sleeping: a snapshot when due, then the time-based flush check.
     *
     * @return true if a snapshot cycle ran
     */
    boolean iterate() {
        boolean fired = false;
        long now = clock.time();
        if (now >= nextSnapshotTime) {
            takeSnapshot();
            fired = true;
            nextSnapshotTime += intervalMillis;
            long after = clock.time();
            if (nextSnapshotTime < after) {
                nextSnapshotTime = after;
            }
        }
        try {
            writers.checkTimeFlush();
        } catch (RuntimeException e) {
            LOGGER.error("[Sampler] Time flush check failed", e);
        }
        return fired;
    }

    private void takeSnapshot() {
        long startNanos = System.nanoTime();
        try {
            Map<Long, Tick> ticks = tickSource.latestTicks();
            if (!spotTokens.isEmpty()) {
                spots.refreshFromTicks(ticks, spotTokens);
            }
            List<SnapshotRow> rows = builder.buildSnapshot(ticks, universe.get(), spots, null);
            writers.writeMany(rows);

            snapshotsTaken++;
            rowsProduced += rows.size();
            lastSnapshotMillis = clock.time();
            observer.onCycle(rows.size(), (System.nanoTime() - startNanos) / 1000);

            if (snapshotsTaken % STATS_LOG_EVERY == 0) {
                LOGGER.info("[Sampler] {} snapshots, {} rows produced, {} ticks cached",
                    snapshotsTaken, rowsProduced, ticks.size());
            }
        } catch (RuntimeException e) {
            failedCycles++;
            observer.onCycleFailed();
            LOGGER.error("[Sampler] Snapshot cycle failed", e);
        }
    }

    private void pause() {
        long wait = Math.min(MAX_SLEEP_MS, nextSnapshotTime - clock.time());
        if (wait <= 0) {
            return;
        }
        try {
            stopLatch.await(wait, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
        }
    }

    /**
     * Requests the loop to end. Returns immediately; the loop exits within one sleep slice.
     */
    public void stop() {
        stopRequested.set(true);
        stopLatch.countDown();
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Sets the epoch millis after which the loop ends on its own.
     */
    public void setDeadline(long deadlineMillis) {
        this.deadlineMillis = deadlineMillis;
    }

    long getNextSnapshotTime() {
        return nextSnapshotTime;
    }

    public SamplerStats stats() {
        return new SamplerStats(snapshotsTaken, rowsProduced, failedCycles, lastSnapshotMillis,
            builder.getMalformedTicks(), builder.getSkippedContracts());
    }
}
