package io.trading.optionchain.persistence;

import java.time.LocalDate;

/**
 * Point-in-time statistics of one writer.
 *
 * @param underlying    Underlying symbol
 * @param currentFile   Open file, null before the first flush or after close
 * @param rowsWritten   Rows written to disk since start
 * @param bufferSize    Rows waiting in memory
 * @param startDate     Start date of the open file
 * @param flushCount    Successful flushes
 * @param failedFlushes Flushes that hit an I/O error
 * @param droppedRows   Rows discarded by failed flushes or written after close
 */
public record WriterStats(
    String underlying,
    String currentFile,
    long rowsWritten,
    int bufferSize,
    LocalDate startDate,
    long flushCount,
    long failedFlushes,
    long droppedRows
) {
}
