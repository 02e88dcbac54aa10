package com.whereq.poolstat.service;

import com.whereq.poolstat.model.SourceRef;
import com.whereq.poolstat.model.SourceType;
import com.whereq.poolstat.model.StateRecord;
import com.whereq.poolstat.query.PoolQueryService;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory pool: canned answers per (source, constraint), with call counting
 */
class FakePoolQueryService implements PoolQueryService {

    private final Map<String, Supplier<Mono<List<StateRecord>>>> answers = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private volatile Supplier<Mono<List<SourceRef>>> sources = () -> Mono.just(List.of());

    FakePoolQueryService schedds(String... names) {
        List<SourceRef> refs = Arrays.stream(names)
            .map(name -> new SourceRef(name, name + ":9618", SourceType.SCHEDD))
            .collect(Collectors.toList());
        sources = () -> Mono.just(refs);
        return this;
    }

    FakePoolQueryService sourcesFail(RuntimeException error) {
        sources = () -> Mono.error(error);
        return this;
    }

    FakePoolQueryService answer(String source, String constraint, List<StateRecord> records) {
        return answer(source, constraint, () -> Mono.just(records));
    }

    FakePoolQueryService fail(String source, String constraint, RuntimeException error) {
        return answer(source, constraint, () -> Mono.error(error));
    }

    FakePoolQueryService answer(String source, String constraint, Supplier<Mono<List<StateRecord>>> answer) {
        answers.put(key(source, constraint), answer);
        return this;
    }

    int calls(String source, String constraint) {
        AtomicInteger count = calls.get(key(source, constraint));
        return count == null ? 0 : count.get();
    }

    @Override
    public Mono<List<SourceRef>> listSources(String pool, SourceType type, String constraint) {
        return sources.get();
    }

    @Override
    public Mono<List<StateRecord>> query(SourceRef source, String constraint, List<String> attributes) {
        String key = key(source.getName(), constraint);
        calls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        Supplier<Mono<List<StateRecord>>> answer = answers.get(key);
        return answer == null ? Mono.just(List.of()) : answer.get();
    }

    private static String key(String source, String constraint) {
        return source + "|" + constraint;
    }
}
