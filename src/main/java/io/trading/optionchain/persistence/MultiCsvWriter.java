package io.trading.optionchain.persistence;

import io.trading.optionchain.model.SnapshotRow;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One {@link RollingCsvWriter} per underlying, routed by the row's underlying symbol.
 * Rows for underlyings without a writer are dropped and counted.
 */
public class MultiCsvWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiCsvWriter.class);

    private final Map<String, RollingCsvWriter> writers;
    private final AtomicLong unroutedRows = new AtomicLong(0);

    public MultiCsvWriter(
        Path outputDir,
        List<String> underlyings,
        String venueToken,
        int flushRows,
        long flushIntervalMs,
        EpochClock clock,
        ZoneId zone
    ) {
        Map<String, RollingCsvWriter> created = new LinkedHashMap<>();
        for (String underlying : underlyings) {
            String key = underlying.toUpperCase(Locale.ROOT);
            created.computeIfAbsent(key, u ->
                new RollingCsvWriter(outputDir, u, venueToken, flushRows, flushIntervalMs, clock, zone));
        }
        this.writers = Collections.unmodifiableMap(created);
        LOGGER.info("[Persistence] Writers for {} in {}", writers.keySet(), outputDir);
    }

    public void write(SnapshotRow row) {
        RollingCsvWriter writer = writerFor(row.underlyingSymbol());
        if (writer == null) {
            unroutedRows.incrementAndGet();
            LOGGER.warn("[Persistence] No writer for underlying: {}", row.underlyingSymbol());
            return;
        }
        writer.write(row);
    }

    /**
     * Groups rows by underlying and hands each group to its writer.
     */
    public void writeMany(List<SnapshotRow> rows) {
        Map<String, List<SnapshotRow>> byUnderlying = new LinkedHashMap<>();
        for (SnapshotRow row : rows) {
            String key = row.underlyingSymbol() == null ? "" : row.underlyingSymbol().toUpperCase(Locale.ROOT);
            byUnderlying.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        for (Map.Entry<String, List<SnapshotRow>> group : byUnderlying.entrySet()) {
            RollingCsvWriter writer = writers.get(group.getKey());
            if (writer == null) {
                unroutedRows.addAndGet(group.getValue().size());
                LOGGER.warn("[Persistence] No writer for underlying: '{}', dropping {} rows",
                    group.getKey(), group.getValue().size());
                continue;
            }
            writer.writeMany(group.getValue());
        }
    }

    public void flush() {
        for (RollingCsvWriter writer : writers.values()) {
            writer.flush();
        }
    }

    public void checkTimeFlush() {
        for (RollingCsvWriter writer : writers.values()) {
            writer.checkTimeFlush();
        }
    }

    /**
     * Closes every writer, even if an earlier one fails.
     */
    @Override
    public void close() {
        for (RollingCsvWriter writer : writers.values()) {
            try {
                writer.close();
            } catch (RuntimeException e) {
                LOGGER.error("[Persistence] Error closing writer {}", writer.getUnderlying(), e);
            }
        }
    }

    /**
     * Statistics per underlying, in configuration order.
     */
    public Map<String, WriterStats> stats() {
        Map<String, WriterStats> stats = new LinkedHashMap<>();
        writers.forEach((underlying, writer) -> stats.put(underlying, writer.stats()));
        return stats;
    }

    public long getUnroutedRows() {
        return unroutedRows.get();
    }

    RollingCsvWriter writerFor(String underlying) {
        if (underlying == null) {
            return null;
        }
        return writers.get(underlying.toUpperCase(Locale.ROOT));
    }
}
