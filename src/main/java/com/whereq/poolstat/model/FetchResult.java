package com.whereq.poolstat.model;

import lombok.Value;

import java.util.List;

/**
 * Records returned by one source for one query.
 * A failed fetch carries no records, the same as a source with nothing to report,
 * but keeps the failure visible for the pass status.
 */
@Value
public class FetchResult<T> {

    String source;

    QueryKind kind;

    List<T> records;

    boolean failed;

    public static <T> FetchResult<T> success(String source, QueryKind kind, List<T> records) {
        return new FetchResult<>(source, kind, List.copyOf(records), false);
    }

    public static <T> FetchResult<T> failure(String source, QueryKind kind) {
        return new FetchResult<>(source, kind, List.of(), true);
    }

    /**
     * Label used in failure reports, e.g. "schedd01.example.org/running"
     */
    public String label() {
        return source + "/" + kind.label();
    }
}
