package com.whereq.poolstat.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a remote daemon in the pool
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRef {

    /**
     * Daemon name, used in logs and failure reports
     */
    private String name;

    /**
     * Network address the query service connects to
     */
    private String address;

    private SourceType type;

    /**
     * The pool's collector, which answers slot queries itself
     */
    public static SourceRef collector(String pool) {
        return new SourceRef(pool, pool, SourceType.COLLECTOR);
    }
}
