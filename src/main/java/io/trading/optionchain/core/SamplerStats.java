package io.trading.optionchain.core;

/**
 * Sampling loop statistics.
 *
 * @param snapshotsTaken     Completed sampling cycles
 * @param rowsProduced       Rows handed to the writers
 * @param failedCycles       Cycles abandoned after an error
 * @param lastSnapshotMillis Epoch millis of the last completed cycle, 0 if none
 * @param malformedTicks     Cached ticks that failed row conversion
 * @param skippedContracts   Contracts left out of a snapshot for lack of a usable tick
 */
public record SamplerStats(
    long snapshotsTaken,
    long rowsProduced,
    long failedCycles,
    long lastSnapshotMillis,
    long malformedTicks,
    long skippedContracts
) {
}
