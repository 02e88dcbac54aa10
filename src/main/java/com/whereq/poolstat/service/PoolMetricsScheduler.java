package com.whereq.poolstat.service;

import com.whereq.poolstat.config.PoolStatProperties;
import com.whereq.poolstat.model.PassKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the enabled passes on a fixed rate and publishes their snapshots
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "poolstat.schedule", name = "enabled", havingValue = "true")
public class PoolMetricsScheduler {

    private final PoolAggregator aggregator;
    private final SnapshotPublisher publisher;
    private final PoolStatProperties properties;

    @Scheduled(fixedRateString = "#{@poolStatProperties.schedule.interval.toMillis()}")
    public void runPasses() {
        List<PassKind> kinds = enabledKinds();
        log.debug("Starting scheduled passes {} for pool {}", kinds, properties.getPool());

        Flux.fromIterable(kinds)
            .concatMap(aggregator::aggregate)
            .doOnNext(publisher::publish)
            .then()
            .block();
    }

    List<PassKind> enabledKinds() {
        List<PassKind> kinds = new ArrayList<>();
        if (properties.getJobs().isEnabled()) {
            kinds.add(PassKind.JOBS);
        }
        if (properties.getSlots().isEnabled()) {
            kinds.add(PassKind.SLOTS);
        }
        return kinds;
    }
}
