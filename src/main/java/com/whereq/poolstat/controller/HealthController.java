package com.whereq.poolstat.controller;

import com.whereq.poolstat.config.PoolStatProperties;
import com.whereq.poolstat.model.PassKind;
import com.whereq.poolstat.service.SnapshotPublisher;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller reporting the outcome of the latest pass of each kind.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private final SnapshotPublisher publisher;
    private final PoolStatProperties properties;

    @GetMapping
    @Operation(summary = "Health check", description = "Check the service and the latest aggregation passes")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromSupplier(() -> {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("service", "whereq-poolstat");
            health.put("pool", properties.getPool());

            Map<String, Object> passes = new HashMap<>();
            for (PassKind kind : PassKind.values()) {
                Map<String, String> pass = new HashMap<>();
                publisher.latest(kind).ifPresentOrElse(snapshot -> {
                    pass.put("status", snapshot.getStatus().name());
                    pass.put("takenAt", String.valueOf(snapshot.getTakenAt()));
                    pass.put("counters", String.valueOf(snapshot.getCounters().size()));
                    pass.put("failedSources", String.valueOf(snapshot.getFailedSources().size()));
                }, () -> pass.put("status", "NONE"));
                passes.put(kind.label(), pass);
            }
            health.put("passes", passes);
            return ResponseEntity.ok(health);
        });
    }
}
