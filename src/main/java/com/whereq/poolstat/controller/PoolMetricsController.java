package com.whereq.poolstat.controller;

import com.whereq.poolstat.model.PassKind;
import com.whereq.poolstat.model.PoolSnapshot;
import com.whereq.poolstat.service.PoolAggregator;
import com.whereq.poolstat.service.SnapshotPublisher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * REST access to pool snapshots.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Pool Metrics", description = "Latest job and slot counters of the pool")
public class PoolMetricsController {

    private final PoolAggregator aggregator;
    private final SnapshotPublisher publisher;

    @GetMapping("/{kind}")
    @Operation(summary = "Latest snapshot", description = "Get the latest published snapshot of a pass kind (jobs or slots)")
    public Mono<ResponseEntity<PoolSnapshot>> latest(@PathVariable String kind) {
        return Mono.fromCallable(() -> PassKind.fromLabel(kind))
            .map(passKind -> publisher.latest(passKind)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Unknown pass kind: {}", kind);
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @PostMapping("/{kind}/refresh")
    @Operation(summary = "Run a pass now", description = "Aggregate the pool immediately and publish the snapshot")
    public Mono<ResponseEntity<PoolSnapshot>> refresh(@PathVariable String kind) {
        return Mono.fromCallable(() -> PassKind.fromLabel(kind))
            .doOnNext(passKind -> log.info("Refresh of {} requested", passKind.label()))
            .flatMap(aggregator::aggregate)
            .doOnNext(publisher::publish)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Unknown pass kind: {}", kind);
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }
}
