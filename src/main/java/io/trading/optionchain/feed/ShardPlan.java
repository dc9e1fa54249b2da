package io.trading.optionchain.feed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Assignment of tokens to feed connections.
 *
 * @param shards          Token lists, one per connection, in input order
 * @param requestedTokens Distinct tokens requested
 * @param duplicateTokens Repeated tokens collapsed before partitioning
 * @param droppedTokens   Distinct tokens left out because capacity was exceeded
 */
public record ShardPlan(
    List<List<Long>> shards,
    int requestedTokens,
    int duplicateTokens,
    int droppedTokens
) {
    public static final int MAX_TOKENS_PER_CONNECTION = 3000;
    public static final int MAX_CONNECTIONS = 3;

    public ShardPlan {
        List<List<Long>> copy = new ArrayList<>(shards.size());
        for (List<Long> shard : shards) {
            copy.add(List.copyOf(shard));
        }
        shards = Collections.unmodifiableList(copy);
    }

    /**
     * Partitions tokens with the default connection limits.
     */
    public static ShardPlan partition(List<Long> tokens) {
        return partition(tokens, MAX_TOKENS_PER_CONNECTION, MAX_CONNECTIONS);
    }

    /**
     * Partitions tokens in input order into at most {@code maxConnections} chunks of at most
     * {@code maxPerConnection}. Duplicates collapse to their first occurrence and tokens beyond
     * capacity are dropped from the tail, so the same input always yields the same plan.
     */
    public static ShardPlan partition(List<Long> tokens, int maxPerConnection, int maxConnections) {
        if (maxPerConnection <= 0 || maxConnections <= 0) {
            throw new IllegalArgumentException("connection limits must be positive");
        }
        Set<Long> distinct = new LinkedHashSet<>();
        int duplicates = 0;
        for (Long token : tokens) {
            if (token == null) {
                continue;
            }
            if (!distinct.add(token)) {
                duplicates++;
            }
        }

        int capacity = maxPerConnection * maxConnections;
        List<List<Long>> shards = new ArrayList<>();
        List<Long> current = new ArrayList<>(Math.min(maxPerConnection, distinct.size()));
        int assigned = 0;
        for (Long token : distinct) {
            if (assigned == capacity) {
                break;
            }
            current.add(token);
            assigned++;
            if (current.size() == maxPerConnection) {
                shards.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            shards.add(current);
        }
        return new ShardPlan(shards, distinct.size(), duplicates, distinct.size() - assigned);
    }

    public int shardCount() {
        return shards.size();
    }

    /**
     * True when tokens were dropped because the subscription capacity was exceeded.
     */
    public boolean truncated() {
        return droppedTokens > 0;
    }

    public int assignedTokens() {
        return requestedTokens - droppedTokens;
    }

    /**
     * All assigned tokens in shard order.
     */
    public List<Long> allTokens() {
        List<Long> all = new ArrayList<>(assignedTokens());
        for (List<Long> shard : shards) {
            all.addAll(shard);
        }
        return all;
    }
}
