package io.trading.optionchain.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.optionchain.core.SamplerStats;
import io.trading.optionchain.feed.OrchestratorStats;
import io.trading.optionchain.feed.ShardExhaustedException;
import io.trading.optionchain.feed.ShardState;
import io.trading.optionchain.persistence.WriterStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecorderMetricsTest {

    private CollectorRegistry registry;
    private RecorderMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new RecorderMetrics(registry, false);
    }

    @Test
    void testCycleCounters() {
        metrics.onCycle(120, 4_500);
        metrics.onCycle(118, 5_500);
        metrics.onCycleFailed();

        assertEquals(2.0, metrics.getCycles());
        assertEquals(238.0, metrics.getRowsProduced());
        assertEquals(1.0, metrics.getFailedCycles());
        assertEquals(2.0, registry.getSampleValue("recorder_cycle_duration_milliseconds_count"));
        assertEquals(10.0, registry.getSampleValue("recorder_cycle_duration_milliseconds_sum"), 1e-9);
    }

    @Test
    void testShardEvents() {
        metrics.onReconnectAttempt("Shard-1", 1, 1000);
        metrics.onReconnectAttempt("Shard-1", 2, 2000);
        metrics.onReconnectAttempt("Shard-2", 1, 1000);
        metrics.onShardExhausted("Shard-2", new ShardExhaustedException("Shard-2", 3000, 50));

        assertEquals(2.0, metrics.getReconnectAttempts("Shard-1"));
        assertEquals(1.0, metrics.getReconnectAttempts("Shard-2"));
        assertEquals(1.0, metrics.getShardsExhausted());
        assertEquals((double) ShardState.EXHAUSTED.ordinal(), registry.getSampleValue(
            "recorder_shard_state", new String[]{"shard"}, new String[]{"Shard-2"}));
    }

    @Test
    void testUpdateSnapshot() {
        WriterStats writer = new WriterStats("NIFTY", "NIFTY_NSEFO_20250102_20250102.csv",
            1000, 42, LocalDate.of(2025, 1, 2), 3, 1, 7);

        metrics.updateSnapshot(new OrchestratorStats(5000, 2, 1, 2, 4, 9),
            new SamplerStats(10, 1200, 0, 1_735_792_200_000L, 3, 6),
            Map.of("Shard-1", ShardState.CONNECTED), Map.of("NIFTY", writer));

        assertEquals(5000.0, registry.getSampleValue("recorder_ticks_received"));
        assertEquals((double) ShardState.CONNECTED.ordinal(), registry.getSampleValue(
            "recorder_shard_state", new String[]{"shard"}, new String[]{"Shard-1"}));
        String[] label = {"underlying"};
        String[] nifty = {"NIFTY"};
        assertEquals(1000.0, registry.getSampleValue("recorder_rows_written", label, nifty));
        assertEquals(42.0, registry.getSampleValue("recorder_rows_buffered", label, nifty));
        assertEquals(7.0, registry.getSampleValue("recorder_rows_dropped", label, nifty));
        assertEquals(4.0, registry.getSampleValue("recorder_decode_errors"));
        assertEquals(9.0, registry.getSampleValue("recorder_rejected_ticks"));
        assertEquals(3.0, registry.getSampleValue("recorder_malformed_ticks"));
        assertEquals(6.0, registry.getSampleValue("recorder_skipped_contracts"));
    }
}
