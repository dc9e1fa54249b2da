package io.trading.optionchain.persistence;

import io.trading.optionchain.model.SnapshotRow;
import org.agrona.concurrent.EpochClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffered, day-rotated CSV writer for one underlying.
 *
 * <p>Rows are formatted on write and kept in memory until the buffer reaches the row limit,
 * the flush interval elapses ({@link #checkTimeFlush()}) or a flush is forced. Each flush first
 * checks for a day change: the open file is closed, renamed so its END date is the last date
 * written, and a new file is opened for today. The header is written only to new files.
 *
 * <p>An I/O failure during a flush is logged, the buffered rows are discarded and the file
 * handle is dropped; the next flush reopens it.
 */
public class RollingCsvWriter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RollingCsvWriter.class);

    private static final String LINE_SEPARATOR = "\n";

    private final Path outputDir;
    private final String underlying;
    private final String venueToken;
    private final int flushRows;
    private final long flushIntervalMs;
    private final EpochClock clock;
    private final ZoneId zone;
    private final String logName;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<String> buffer = new ArrayList<>();

    private BufferedWriter out;
    private Path currentFile;
    private LocalDate startDate;
    private LocalDate lastWrittenDate;
    private long lastFlushTime;
    private boolean closed = false;

    private long rowsWritten = 0;
    private long flushCount = 0;
    private long failedFlushes = 0;
    private long droppedRows = 0;

    public RollingCsvWriter(
        Path outputDir,
        String underlying,
        String venueToken,
        int flushRows,
        long flushIntervalMs,
        EpochClock clock,
        ZoneId zone
    ) {
        if (flushRows <= 0) {
            throw new IllegalArgumentException("flushRows must be positive: " + flushRows);
        }
        if (flushIntervalMs <= 0) {
            throw new IllegalArgumentException("flushIntervalMs must be positive: " + flushIntervalMs);
        }
        this.outputDir = outputDir;
        this.underlying = underlying.toUpperCase(Locale.ROOT);
        this.venueToken = venueToken;
        this.flushRows = flushRows;
        this.flushIntervalMs = flushIntervalMs;
        this.clock = clock;
        this.zone = zone;
        this.logName = "Writer-" + this.underlying;
        this.lastFlushTime = clock.time();
    }

    /**
     * Buffers one row and flushes when the buffer is full.
     */
    public void write(SnapshotRow row) {
        String line = CsvValueFormatter.formatRow(row);
        lock.lock();
        try {
            if (rejectIfClosed(1)) {
                return;
            }
            buffer.add(line);
            if (buffer.size() >= flushRows) {
                doFlush();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buffers rows and flushes once if the buffer is full afterwards.
     */
    public void writeMany(List<SnapshotRow> rows) {
        if (rows.isEmpty()) {
            return;
        }
        List<String> lines = new ArrayList<>(rows.size());
        for (SnapshotRow row : rows) {
            lines.add(CsvValueFormatter.formatRow(row));
        }
        lock.lock();
        try {
            if (rejectIfClosed(lines.size())) {
                return;
            }
            buffer.addAll(lines);
            if (buffer.size() >= flushRows) {
                doFlush();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes a non-empty buffer when the flush interval has elapsed since the last flush.
     *
     * @return true if a flush happened
     */
    public boolean checkTimeFlush() {
        lock.lock();
        try {
            if (buffer.isEmpty() || clock.time() - lastFlushTime < flushIntervalMs) {
                return false;
            }
            return doFlush();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces a flush regardless of thresholds.
     */
    public void flush() {
        lock.lock();
        try {
            doFlush();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes remaining rows and closes the file. Later calls do nothing.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            doFlush();
            closeFile();
            LOGGER.info("[{}] Closed, {} rows written in {} flushes ({} failed, {} rows dropped)",
                logName, rowsWritten, flushCount, failedFlushes, droppedRows);
        } finally {
            lock.unlock();
        }
    }

    public WriterStats stats() {
        lock.lock();
        try {
            return new WriterStats(
                underlying,
                currentFile == null ? null : currentFile.toString(),
                rowsWritten,
                buffer.size(),
                startDate,
                flushCount,
                failedFlushes,
                droppedRows
            );
        } finally {
            lock.unlock();
        }
    }

    public String getUnderlying() {
        return underlying;
    }

    private boolean rejectIfClosed(int rows) {
        if (closed) {
            droppedRows += rows;
            LOGGER.warn("[{}] Writer closed, dropping {} rows", logName, rows);
            return true;
        }
        return false;
    }

    // Caller holds the lock.
    private boolean doFlush() {
        if (buffer.isEmpty()) {
            return false;
        }
        LocalDate today = today();
        checkRollover(today);

        int rows = buffer.size();
        try {
            appendBuffer(today);
            rowsWritten += rows;
            flushCount++;
            lastWrittenDate = today;
            LOGGER.debug("[{}] Flushed {} rows, total {}", logName, rows, rowsWritten);
            return true;
        } catch (PersistenceWriteException e) {
            failedFlushes++;
            droppedRows += rows;
            LOGGER.error("[{}] {}", logName, e.getMessage(), e);
            closeFile();
            return false;
        } finally {
            buffer.clear();
            lastFlushTime = clock.time();
        }
    }

    private void appendBuffer(LocalDate today) {
        Path target = currentFile != null ? currentFile : outputDir.resolve(
            OutputFileNames.fileName(underlying, venueToken, startDate != null ? startDate : today));
        try {
            if (out == null) {
                openFile(today);
            }
            for (String line : buffer) {
                out.write(line);
                out.write(LINE_SEPARATOR);
            }
            out.flush();
        } catch (IOException e) {
            throw new PersistenceWriteException(target, buffer.size(), e);
        }
    }

    private void openFile(LocalDate today) throws IOException {
        if (startDate == null) {
            startDate = today;
        }
        Files.createDirectories(outputDir);
        Path path = outputDir.resolve(OutputFileNames.fileName(underlying, venueToken, startDate));
        boolean exists = Files.exists(path);
        out = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        currentFile = path;
        if (!exists) {
            out.write(CsvValueFormatter.header());
            out.write(LINE_SEPARATOR);
            LOGGER.info("[{}] Created new file with header: {}", logName, path);
        } else {
            LOGGER.info("[{}] Appending to existing file: {}", logName, path);
        }
    }

    private void checkRollover(LocalDate today) {
        if (startDate == null || startDate.equals(today)) {
            return;
        }
        LOGGER.info("[{}] Day rollover detected: {} -> {}", logName, startDate, today);
        closeFile();
        if (currentFile != null && Files.exists(currentFile)) {
            LocalDate end = lastWrittenDate != null ? lastWrittenDate : startDate;
            Path renamed = outputDir.resolve(OutputFileNames.fileName(underlying, venueToken, startDate, end));
            moveIfAbsent(currentFile, renamed);
        }
        currentFile = null;
        startDate = today;
        lastWrittenDate = null;
    }

    /**
     * Renames {@code source} to {@code target} unless the target already exists.
     *
     * @return true if the file was renamed
     */
    static boolean moveIfAbsent(Path source, Path target) {
        if (source.equals(target)) {
            return false;
        }
        if (Files.exists(target)) {
            LOGGER.warn("Not renaming {}: {} already exists", source.getFileName(), target.getFileName());
            return false;
        }
        try {
            Files.move(source, target);
            LOGGER.info("Renamed {} to {}", source.getFileName(), target.getFileName());
            return true;
        } catch (IOException e) {
            LOGGER.error("Failed to rename {} to {}: {}", source, target, e.getMessage());
            return false;
        }
    }

    private void closeFile() {
        if (out == null) {
            return;
        }
        try {
            out.close();
        } catch (IOException e) {
            LOGGER.error("[{}] Error closing {}: {}", logName, currentFile, e.getMessage());
        } finally {
            out = null;
        }
    }

    private LocalDate today() {
        return Instant.ofEpochMilli(clock.time()).atZone(zone).toLocalDate();
    }
}
