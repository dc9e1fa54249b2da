package io.trading.optionchain.persistence;

import org.agrona.concurrent.CachedEpochClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MultiCsvWriterTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 2);

    @TempDir
    Path dir;

    private final CachedEpochClock clock = new CachedEpochClock();

    private MultiCsvWriter writers(int flushRows) {
        clock.update(Instant.parse("2025-01-02T04:30:00Z").toEpochMilli());
        return new MultiCsvWriter(dir, List.of("NIFTY", "banknifty"), "NSEFO", flushRows, 1000, clock,
            ZoneId.of("Asia/Kolkata"));
    }

    @Test
    void testRowsRoutedByUnderlying() throws IOException {
        MultiCsvWriter writers = writers(100);

        writers.writeMany(List.of(
            TestRows.row("NIFTY", 1),
            TestRows.row("BANKNIFTY", 1),
            TestRows.row("nifty", 2)
        ));
        writers.flush();

        assertEquals(3, Files.readAllLines(dir.resolve(OutputFileNames.fileName("NIFTY", "NSEFO", DAY))).size());
        assertEquals(2, Files.readAllLines(dir.resolve(OutputFileNames.fileName("BANKNIFTY", "NSEFO", DAY))).size());
        writers.close();
    }

    @Test
    void testUnknownUnderlyingDropped() {
        MultiCsvWriter writers = writers(100);

        writers.write(TestRows.row("FINNIFTY", 1));
        writers.writeMany(List.of(TestRows.row("SENSEX", 1), TestRows.row("SENSEX", 2), TestRows.row("NIFTY", 3)));

        assertEquals(3, writers.getUnroutedRows());
        assertEquals(1, writers.stats().get("NIFTY").bufferSize());
        writers.close();
    }

    @Test
    void testStatsInConfigurationOrder() {
        MultiCsvWriter writers = writers(100);

        Map<String, WriterStats> stats = writers.stats();

        assertEquals(List.of("NIFTY", "BANKNIFTY"), List.copyOf(stats.keySet()));
        assertNotNull(writers.writerFor("banknifty"));
        assertNull(writers.writerFor(null));
        writers.close();
    }

    @Test
    void testCheckTimeFlushAndCloseFanOut() {
        MultiCsvWriter writers = writers(100);
        writers.write(TestRows.row("NIFTY", 1));
        writers.write(TestRows.row("BANKNIFTY", 1));

        clock.advance(1000);
        writers.checkTimeFlush();

        assertEquals(1, writers.stats().get("NIFTY").rowsWritten());
        assertEquals(1, writers.stats().get("BANKNIFTY").rowsWritten());

        writers.write(TestRows.row("NIFTY", 2));
        writers.close();
        writers.close();
        assertEquals(2, writers.stats().get("NIFTY").rowsWritten());
    }
}
