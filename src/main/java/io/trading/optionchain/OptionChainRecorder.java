package io.trading.optionchain;

import io.trading.optionchain.config.ConfigurationException;
import io.trading.optionchain.config.RecorderConfig;
import io.trading.optionchain.core.MarketHours;
import io.trading.optionchain.core.RecorderController;
import io.trading.optionchain.feed.FeedConnectionFactory;
import io.trading.optionchain.feed.FeedExhaustedException;
import io.trading.optionchain.feed.relay.RelayFeedConnection;
import io.trading.optionchain.metrics.RecorderMetrics;
import io.trading.optionchain.snapshot.SpotPriceBook;
import io.trading.optionchain.upstream.EnvSessionProvider;
import io.trading.optionchain.upstream.InstrumentProvider;
import io.trading.optionchain.upstream.Session;
import io.trading.optionchain.upstream.UniverseFileProvider;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.agrona.concurrent.SystemEpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the option chain recorder.
 *
 * <p>Records one session per trading day between market open and close, idling outside
 * market hours, until a shutdown signal arrives. Configuration comes from the YAML file
 * given as the first argument, or from environment variables.
 */
public class OptionChainRecorder {

    private static final Logger LOGGER = LoggerFactory.getLogger(OptionChainRecorder.class);

    private static final long MAX_IDLE_WAIT_MS = 60_000;

    private final RecorderConfig config;
    private final Session session;
    private final MarketHours marketHours;
    private final RecorderMetrics metrics;
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile RecorderController current;

    public OptionChainRecorder(RecorderConfig config, Session session) {
        this.config = config;
        this.session = session;
        this.marketHours = new MarketHours(config.marketOpen(), config.marketClose(), config.timezone());
        this.metrics = config.metricsPort() > 0 ? new RecorderMetrics() : null;
    }

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Option Chain Recorder Starting...");
        LOGGER.info("========================================");

        try {
            RecorderConfig config = args.length > 0
                ? RecorderConfig.fromYaml(Paths.get(args[0]))
                : RecorderConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Underlyings: {}", config.underlyings());
            LOGGER.info("  Sampling interval: {} s", config.samplingIntervalSeconds());
            LOGGER.info("  Output dir: {}", config.outputDir());
            LOGGER.info("  Feed URL: {}", config.feedUrl());
            LOGGER.info("  Market hours: {} - {} {}", config.marketOpen(), config.marketClose(), config.timezone());

            Session session = new EnvSessionProvider().session();
            OptionChainRecorder recorder = new OptionChainRecorder(config, session);

            ShutdownSignalBarrier shutdownBarrier = new ShutdownSignalBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));
            Thread watcher = new Thread(() -> {
                shutdownBarrier.await();
                LOGGER.info("Shutdown signal received");
                recorder.requestStop();
            }, "shutdown-watcher");
            watcher.setDaemon(true);
            watcher.start();

            recorder.run();
        } catch (ConfigurationException e) {
            LOGGER.error("Configuration error: {}", e.getMessage());
            System.exit(1);
        } catch (FeedExhaustedException e) {
            LOGGER.error("Feed lost: {}", e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            LOGGER.error("Fatal error in Option Chain Recorder", e);
            System.exit(1);
        }

        LOGGER.info("Option Chain Recorder exited");
    }

    /**
     * Records sessions until {@link #requestStop()} is called.
     *
     * @throws IOException            if the metrics server cannot start
     * @throws FeedExhaustedException if every shard of a session gave up reconnecting
     */
    public void run() throws IOException {
        while (!isStopRequested()) {
            ZonedDateTime now = ZonedDateTime.now(config.timezone());
            if (!marketHours.isOpen(now)) {
                ZonedDateTime nextOpen = marketHours.nextOpen(now);
                LOGGER.info("Market {} at {}, next session opens {}", marketHours.phase(now), now, nextOpen);
                waitUntil(nextOpen);
                continue;
            }
            runSession(marketHours.sessionClose(now));
        }
    }

    private void runSession(ZonedDateTime close) throws IOException {
        LOGGER.info("Starting session until {}", close);
        RecorderController controller = createController();
        current = controller;
        try {
            controller.start();
            if (!isStopRequested()) {
                controller.runSession(close.toInstant().toEpochMilli());
            }
        } finally {
            current = null;
            controller.shutdown();
        }
    }

    private RecorderController createController() {
        SpotPriceBook spots = new SpotPriceBook();
        InstrumentProvider instruments = new UniverseFileProvider(
            config.universeFile(),
            config.spotPrices(),
            config.contractSelection(),
            spots,
            Clock.system(config.timezone())
        );
        FeedConnectionFactory feedFactory = shardIndex ->
            new RelayFeedConnection(config.feedUrl(), session, "Shard-" + (shardIndex + 1));
        return new RecorderController(config, feedFactory, instruments, spots, SystemEpochClock.INSTANCE, metrics);
    }

    private void waitUntil(ZonedDateTime target) {
        long remaining = Duration.between(ZonedDateTime.now(config.timezone()), target).toMillis();
        while (remaining > 0 && !isStopRequested()) {
            try {
                stopLatch.await(Math.min(remaining, MAX_IDLE_WAIT_MS), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                requestStop();
            }
            remaining = Duration.between(ZonedDateTime.now(config.timezone()), target).toMillis();
        }
    }

    /**
     * Ends the running session, if any, and stops the day loop.
     */
    public void requestStop() {
        stopLatch.countDown();
        RecorderController controller = current;
        if (controller != null) {
            controller.requestStop();
        }
    }

    private boolean isStopRequested() {
        return stopLatch.getCount() == 0;
    }
}
