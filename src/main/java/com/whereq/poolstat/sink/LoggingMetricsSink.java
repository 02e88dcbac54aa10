package com.whereq.poolstat.sink;

import com.whereq.poolstat.model.PoolSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes every counter of a snapshot to the log, one line per counter at DEBUG
 */
@Slf4j
@Component
public class LoggingMetricsSink implements MetricsSink {

    @Override
    public void accept(PoolSnapshot snapshot) {
        log.info("{} snapshot {} at {}: {} counters from {} records",
            snapshot.getKind().label(), snapshot.getStatus(), snapshot.getTakenAt(),
            snapshot.getCounters().size(), snapshot.getRecordCount());

        if (log.isDebugEnabled()) {
            snapshot.getCounters().forEach((name, value) -> log.debug("{} {}", name, value));
        }
    }
}
