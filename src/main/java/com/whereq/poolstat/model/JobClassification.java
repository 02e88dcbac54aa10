package com.whereq.poolstat.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Which rollups a job record contributes to
 */
@Value
@Builder
public class JobClassification {

    /**
     * First accounting-group token, "unknown" when the group can't be parsed
     */
    String experiment;

    /**
     * Record owner, "unknown" when absent
     */
    String user;

    /**
     * Accounting-group tokens below the experiment, without a trailing per-user group
     */
    @Singular("subgroup")
    List<String> subgroups;

    /**
     * Lifecycle class the suffixes were chosen from
     */
    JobStatus status;

    /**
     * Status-specific counter suffixes, e.g. ".running.totals", ".running.sites.FNAL"
     */
    @Singular("counterSuffix")
    List<String> counterSuffixes;

    /**
     * Full metric name prefixes: every suffix expanded over the global, experiment, user and subgroup rollups
     */
    @Singular("metricPrefix")
    List<String> metricPrefixes;
}
