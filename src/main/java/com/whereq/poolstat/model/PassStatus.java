package com.whereq.poolstat.model;

/**
 * Outcome of one aggregation pass
 */
public enum PassStatus {
    /**
     * Every source answered every query
     */
    COMPLETE,

    /**
     * At least one source gave up or failed; its contribution is missing from the counters
     */
    DEGRADED,

    /**
     * Sources could not be enumerated; the counters are empty
     */
    FAILED
}
