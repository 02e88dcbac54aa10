package com.whereq.poolstat.service;

import com.whereq.poolstat.model.PassKind;
import com.whereq.poolstat.model.PoolSnapshot;
import com.whereq.poolstat.sink.MetricsSink;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the latest snapshot of each pass kind and hands new ones to every sink
 */
@Slf4j
@Service
public class SnapshotPublisher {

    private final List<MetricsSink> sinks;
    private final Map<PassKind, PoolSnapshot> latest = new ConcurrentHashMap<>();

    public SnapshotPublisher(List<MetricsSink> sinks, MeterRegistry meterRegistry) {
        this.sinks = List.copyOf(sinks);

        for (PassKind kind : PassKind.values()) {
            Gauge.builder("poolstat.snapshot.keys", () -> latest(kind).map(s -> s.getCounters().size()).orElse(0))
                .description("Counters in the latest snapshot")
                .tag("kind", kind.label())
                .register(meterRegistry);
        }
        log.info("SnapshotPublisher initialized with {} sinks", this.sinks.size());
    }

    /**
     * Replace the latest snapshot of its kind and forward it.
     * A failing sink is logged and skipped; the others still receive the snapshot.
     */
    public void publish(PoolSnapshot snapshot) {
        latest.put(snapshot.getKind(), snapshot);

        for (MetricsSink sink : sinks) {
            try {
                sink.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("Sink {} rejected {} snapshot: {}", sink.getClass().getSimpleName(),
                    snapshot.getKind().label(), e.getMessage(), e);
            }
        }
    }

    public Optional<PoolSnapshot> latest(PassKind kind) {
        return Optional.ofNullable(latest.get(kind));
    }
}
