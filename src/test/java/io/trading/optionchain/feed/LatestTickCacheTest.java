package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LatestTickCacheTest {

    private final LatestTickCache cache = new LatestTickCache();

    @Test
    void testLatestWriteWins() {
        cache.put(Tick.lastTradeOnly(1, 100.0, 5L));
        cache.put(Tick.lastTradeOnly(1, 101.5, 2L));

        assertEquals(1, cache.size());
        assertEquals(101.5, cache.get(1).lastPrice());
        assertEquals(2L, cache.get(1).lastQuantity());
    }

    @Test
    void testPutAllSkipsNulls() {
        cache.putAll(Arrays.asList(Tick.lastTradeOnly(1, 10.0, 1L), null, Tick.lastTradeOnly(2, 20.0, 1L)));

        assertEquals(2, cache.size());
        assertNull(cache.get(3));
    }

    @Test
    void testSnapshotIsIsolatedFromLaterUpdates() {
        cache.put(Tick.lastTradeOnly(1, 10.0, 1L));
        Map<Long, Tick> snapshot = cache.snapshot();

        cache.put(Tick.lastTradeOnly(1, 11.0, 1L));
        cache.put(Tick.lastTradeOnly(2, 20.0, 1L));

        assertEquals(1, snapshot.size());
        assertEquals(10.0, snapshot.get(1L).lastPrice());
    }

    @Test
    void testRetainTokens() {
        cache.putAll(List.of(
            Tick.lastTradeOnly(1, 10.0, 1L),
            Tick.lastTradeOnly(2, 20.0, 1L),
            Tick.lastTradeOnly(3, 30.0, 1L)
        ));

        cache.retainTokens(List.of(2L, 3L, 4L));

        assertEquals(2, cache.size());
        assertNull(cache.get(1));
        assertNotNull(cache.get(3));
    }

    @Test
    void testConcurrentWriters() throws InterruptedException {
        Thread[] writers = new Thread[3];
        for (int w = 0; w < writers.length; w++) {
            int offset = w * 1000;
            writers[w] = new Thread(() -> {
                for (int i = 1; i <= 1000; i++) {
                    cache.put(Tick.lastTradeOnly(offset + i, (double) i, 1L));
                }
            });
            writers[w].start();
        }
        for (Thread writer : writers) {
            writer.join();
        }

        assertEquals(3000, cache.size());
    }
}
