package io.trading.optionchain.feed;

import io.trading.optionchain.model.Tick;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Latest tick per token, shared by all shards.
 * A put replaces the whole tick for its token; the most recent write wins regardless of
 * which shard delivered it. The lock is held only for one batch or one copy.
 */
public final class LatestTickCache {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Tick> ticks = new HashMap<>();

    public void put(Tick tick) {
        if (tick == null) {
            return;
        }
        lock.lock();
        try {
            ticks.put(tick.token(), tick);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a batch under one lock acquisition. Null entries are skipped.
     */
    public void putAll(List<Tick> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (Tick tick : batch) {
                if (tick != null) {
                    ticks.put(tick.token(), tick);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a point-in-time copy. Later updates do not affect the returned map.
     */
    public Map<Long, Tick> snapshot() {
        lock.lock();
        try {
            return new HashMap<>(ticks);
        } finally {
            lock.unlock();
        }
    }

    public Tick get(long token) {
        lock.lock();
        try {
            return ticks.get(token);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry whose token is not in the given set.
     */
    public void retainTokens(Collection<Long> tokens) {
        Set<Long> keep = new HashSet<>(tokens);
        lock.lock();
        try {
            ticks.keySet().retainAll(keep);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return ticks.size();
        } finally {
            lock.unlock();
        }
    }
}
