package com.whereq.poolstat.query;

import com.whereq.poolstat.model.SourceRef;
import com.whereq.poolstat.model.SourceType;
import com.whereq.poolstat.model.StateRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Pool query interface: enumerate daemons and query them for state records
 *
 * Implementations signal {@link com.whereq.poolstat.exception.TransientQueryException} for
 * communication failures worth retrying; any other error is final for that source.
 */
public interface PoolQueryService {
    /**
     * List the daemons of a pool
     *
     * @param pool collector address
     * @param type kind of daemon to list
     * @param constraint source-selection predicate, "true" for all
     * @return Mono with the matching sources
     */
    Mono<List<SourceRef>> listSources(String pool, SourceType type, String constraint);

    /**
     * Query one source for records
     *
     * @param source the daemon to ask
     * @param constraint record-selection predicate
     * @param attributes attributes to project; records may carry fewer
     * @return Mono with the matching records
     */
    Mono<List<StateRecord>> query(SourceRef source, String constraint, List<String> attributes);
}
