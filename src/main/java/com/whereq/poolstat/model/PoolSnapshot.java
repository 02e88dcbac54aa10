package com.whereq.poolstat.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one aggregation pass: dotted counter names to values, plus how complete the pass was
 */
@Value
@Builder
public class PoolSnapshot {

    PassKind kind;

    PassStatus status;

    /**
     * Counter name to value, sorted by name
     */
    Map<String, Double> counters;

    /**
     * "source/query" labels of fetches that exhausted their retries or failed outright
     */
    @Singular("failedSource")
    List<String> failedSources;

    /**
     * Number of records folded into the counters
     */
    long recordCount;

    Instant takenAt;

    public static PoolSnapshot failed(PassKind kind, Instant takenAt) {
        return PoolSnapshot.builder()
            .kind(kind)
            .status(PassStatus.FAILED)
            .counters(Map.of())
            .recordCount(0)
            .takenAt(takenAt)
            .build();
    }

    public double get(String name) {
        return counters.getOrDefault(name, 0.0);
    }

    public boolean contains(String name) {
        return counters.containsKey(name);
    }
}
