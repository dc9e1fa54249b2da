package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.trading.optionchain.feed.FeedShardTest.awaitCondition;
import static org.junit.jupiter.api.Assertions.*;

class FeedOrchestratorTest {

    private final List<FakeFeedConnection> connections = new ArrayList<>();
    private final FeedShardTest.RecordingListener listener = new FeedShardTest.RecordingListener();
    private FeedOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private FeedOrchestrator newOrchestrator(boolean autoConnect, int maxAttempts) {
        FeedConnectionFactory factory = index -> {
            FakeFeedConnection connection = new FakeFeedConnection();
            if (autoConnect) {
                connection.autoConnect();
            }
            connections.add(connection);
            return connection;
        };
        return new FeedOrchestrator(factory, new ReconnectPolicy(1, 2, maxAttempts), listener, 2, 3);
    }

    @Test
    void testConfigureShardsTokens() {
        orchestrator = newOrchestrator(true, 3);

        ShardPlan plan = orchestrator.configure(List.of(1L, 2L, 3L, 4L, 5L));

        assertEquals(3, plan.shardCount());
        assertEquals(3, connections.size());
        assertEquals(List.of(1L, 2L), orchestrator.getShards().get(0).getTokens());
        assertEquals(List.of(5L), orchestrator.getShards().get(2).getTokens());
        assertEquals(3, orchestrator.stats().shardCount());
    }

    @Test
    void testStartSubscribesEveryShard() {
        orchestrator = newOrchestrator(true, 3);
        orchestrator.configure(List.of(1L, 2L, 3L, 4L));

        orchestrator.start();

        assertEquals(List.of(List.of(1L, 2L)), connections.get(0).subscriptions);
        assertEquals(List.of(List.of(3L, 4L)), connections.get(1).subscriptions);
        Map<String, ShardState> states = orchestrator.shardStates();
        assertEquals(List.of("Shard-1", "Shard-2"), new ArrayList<>(states.keySet()));
        assertTrue(states.values().stream().allMatch(s -> s == ShardState.CONNECTED));
    }

    @Test
    void testTicksFromAllShardsMergeIntoOneCache() {
        orchestrator = newOrchestrator(true, 3);
        orchestrator.configure(List.of(1L, 2L, 3L));
        orchestrator.start();

        connections.get(0).fireTicks(Tick.lastTradeOnly(1, 10.0, 1L), Tick.lastTradeOnly(2, 20.0, 1L));
        connections.get(1).fireTicks(Tick.lastTradeOnly(3, 30.0, 1L));

        Map<Long, Tick> ticks = orchestrator.latestTicks();
        assertEquals(3, ticks.size());
        assertEquals(30.0, ticks.get(3L).lastPrice());
        assertEquals(3, orchestrator.stats().ticksReceived());
    }

    @Test
    void testTruncatedPlanReported() {
        orchestrator = newOrchestrator(true, 3);

        ShardPlan plan = orchestrator.configure(List.of(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L));

        assertTrue(plan.truncated());
        assertEquals(2, plan.droppedTokens());
        assertEquals(3, orchestrator.getShards().size());
    }

    @Test
    void testReconfigureStopsRunningShardsAndTrimsCache() {
        orchestrator = newOrchestrator(true, 3);
        orchestrator.configure(List.of(1L, 2L, 3L));
        orchestrator.start();
        connections.get(0).fireTicks(Tick.lastTradeOnly(1, 10.0, 1L), Tick.lastTradeOnly(2, 20.0, 1L));
        List<FeedShard> oldShards = orchestrator.getShards();

        orchestrator.configure(List.of(2L, 9L));

        for (FeedShard shard : oldShards) {
            assertEquals(ShardState.STOPPED, shard.getState());
        }
        assertEquals(1, orchestrator.getShards().size());
        assertEquals(ShardState.DISCONNECTED, orchestrator.getShards().get(0).getState());
        assertEquals(Set.of(2L), orchestrator.latestTicks().keySet());

        orchestrator.start();
        assertEquals(List.of(List.of(2L, 9L)), connections.get(2).subscriptions);
    }

    @Test
    void testStatsSumDecodeAndValidationCounters() {
        orchestrator = newOrchestrator(true, 3);
        orchestrator.configure(List.of(1L, 2L, 3L, 4L));
        connections.get(0).decodeErrors = 2;
        connections.get(1).decodeErrors = 1;
        connections.get(1).rejectedTicks = 5;

        OrchestratorStats stats = orchestrator.stats();

        assertEquals(3, stats.decodeErrors());
        assertEquals(5, stats.rejectedTicks());
    }

    @Test
    void testAllShardsExhausted() {
        orchestrator = newOrchestrator(false, 0);
        orchestrator.configure(List.of(1L, 2L, 3L));
        orchestrator.start();
        assertFalse(orchestrator.allShardsExhausted());

        connections.get(0).fireError(-1, "refused");
        assertFalse(orchestrator.allShardsExhausted());
        connections.get(1).fireClose(1006, "connection lost");

        assertTrue(orchestrator.allShardsExhausted());
        assertEquals(2, listener.exhausted.size());
    }

    @Test
    void testEmptyOrchestratorIsNotExhausted() {
        orchestrator = newOrchestrator(true, 3);

        assertFalse(orchestrator.allShardsExhausted());
        orchestrator.start();
        assertTrue(orchestrator.latestTicks().isEmpty());
    }

    @Test
    void testReconnectAttemptsForwardedToListener() {
        orchestrator = newOrchestrator(true, 3);
        orchestrator.configure(List.of(1L));
        orchestrator.start();

        connections.get(0).fireClose(1006, "connection lost");

        assertEquals(List.of("Shard-1#1"), listener.attempts);
        awaitCondition(() -> connections.get(0).subscriptions.size() == 2, "re-subscription");
        assertEquals(1, orchestrator.stats().reconnectCount());
    }

    @Test
    void testStopContinuesPastFailingShard() {
        FeedConnectionFactory factory = index -> {
            FakeFeedConnection connection = new FakeFeedConnection().autoConnect();
            if (index == 0) {
                connection.failOnClose(new IllegalStateException("broken"));
            }
            connections.add(connection);
            return connection;
        };
        orchestrator = new FeedOrchestrator(factory, new ReconnectPolicy(1, 2, 3), listener, 1, 3);
        orchestrator.configure(List.of(1L, 2L));
        orchestrator.start();

        orchestrator.stop();

        assertEquals(1, connections.get(1).closeCount.get());
        assertTrue(orchestrator.shardStates().values().stream().allMatch(s -> s == ShardState.STOPPED));
    }
}
