package com.whereq.poolstat.service;

import com.whereq.poolstat.exception.TransientQueryException;
import com.whereq.poolstat.model.FetchResult;
import com.whereq.poolstat.model.QueryKind;
import com.whereq.poolstat.model.RetryPolicy;
import com.whereq.poolstat.model.SourceRef;
import com.whereq.poolstat.model.SourceType;
import com.whereq.poolstat.model.StateRecord;
import com.whereq.poolstat.query.PoolQueryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs pool queries with bounded, fixed-delay retries, one source at a time
 *
 * A source that keeps failing never fails the caller: once its attempts are used up the
 * fetch completes with an empty, failed {@link FetchResult} and the pass carries on.
 */
@Slf4j
public class RecordFetcher {

    private final PoolQueryService queryService;
    private final RetryPolicy retryPolicy;
    private final Map<QueryKind, Counter> failureCounters = new EnumMap<>(QueryKind.class);

    public RecordFetcher(PoolQueryService queryService, RetryPolicy retryPolicy, MeterRegistry meterRegistry) {
        if (retryPolicy.getMaxRetries() < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1, got " + retryPolicy.getMaxRetries());
        }
        this.queryService = queryService;
        this.retryPolicy = retryPolicy;

        for (QueryKind kind : QueryKind.values()) {
            failureCounters.put(kind, Counter.builder("poolstat.fetch.failures")
                .description("Number of source queries abandoned after retries or a fatal error")
                .tag("query", kind.label())
                .register(meterRegistry));
        }
    }

    /**
     * Query one source for records
     *
     * @param source the daemon to ask
     * @param kind what is being fetched, for logs and failure reports
     * @param constraint record-selection predicate
     * @param attributes attribute projection
     * @return Mono with the records, or an empty failed result once retries are exhausted
     */
    public Mono<FetchResult<StateRecord>> fetch(SourceRef source, QueryKind kind, String constraint,
                                                List<String> attributes) {
        return withRetry(source.getName(), kind,
            Mono.defer(() -> queryService.query(source, constraint, attributes)));
    }

    /**
     * Enumerate the daemons of a pool, with the same retry behaviour as a record query
     */
    public Mono<FetchResult<SourceRef>> fetchSources(String pool, SourceType type, String constraint) {
        return withRetry(pool, QueryKind.SOURCES,
            Mono.defer(() -> queryService.listSources(pool, type, constraint)));
    }

    private <T> Mono<FetchResult<T>> withRetry(String source, QueryKind kind, Mono<List<T>> query) {
        return query
            .defaultIfEmpty(List.of())
            .doOnError(TransientQueryException.class, e ->
                log.warn("Trouble communicating with {} for {} query: {}. Retrying in {}s if attempts remain.",
                    source, kind.label(), e.getMessage(), retryPolicy.getDelay().toSeconds()))
            .retryWhen(Retry.fixedDelay(retryPolicy.retriesAfterFirstAttempt(), retryPolicy.getDelay())
                .filter(TransientQueryException.class::isInstance)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .map(records -> FetchResult.success(source, kind, records))
            .onErrorResume(e -> {
                if (e instanceof TransientQueryException) {
                    log.error("Trouble communicating with {} for {} query, giving up after {} attempts.",
                        source, kind.label(), retryPolicy.getMaxRetries());
                } else {
                    log.error("{} query on {} failed: {}", kind.label(), source, e.getMessage(), e);
                }
                failureCounters.get(kind).increment();
                return Mono.just(FetchResult.<T>failure(source, kind));
            });
    }
}
