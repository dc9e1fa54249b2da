package io.trading.optionchain.core;

import io.trading.optionchain.feed.TickSource;
import io.trading.optionchain.model.Tick;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

class FakeTickSource implements TickSource {

    final Map<Long, Tick> ticks = new ConcurrentHashMap<>();
    volatile boolean exhausted = false;

    @Override
    public Map<Long, Tick> latestTicks() {
        return Map.copyOf(ticks);
    }

    @Override
    public boolean allShardsExhausted() {
        return exhausted;
    }
}
