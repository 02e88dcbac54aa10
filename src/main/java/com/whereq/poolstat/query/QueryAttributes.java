package com.whereq.poolstat.query;

import com.whereq.poolstat.model.JobStatus;

import java.util.List;

import static com.whereq.poolstat.model.Attributes.*;

/**
 * Filters and attribute projections for each query the aggregator issues
 */
public final class QueryAttributes {

    private QueryAttributes() {
    }

    public static final String ALL = "true";

    public static final String IDLE_FILTER = JobStatus.STATUS_ATTRIBUTE + "==" + JobStatus.IDLE_CODE;
    public static final String RUNNING_FILTER = JobStatus.STATUS_ATTRIBUTE + "==" + JobStatus.RUNNING_CODE;
    public static final String HELD_FILTER = JobStatus.STATUS_ATTRIBUTE + "==" + JobStatus.HELD_CODE;

    public static final List<String> IDLE_JOB = List.of(
        CLUSTER_ID, PROC_ID, OWNER,
        ACCOUNTING_GROUP, JOB_STATUS,
        DESIRED_USAGE_MODEL, DESIRED_SITES, JOB_UNIVERSE,
        QUEUE_DATE, REQUEST_MEMORY, REQUEST_DISK, REQUEST_CPUS, REQUEST_GPUS);

    public static final List<String> RUNNING_JOB = List.of(
        CLUSTER_ID, PROC_ID, OWNER,
        MATCH_SITE, MATCH_RESOURCE_NAME,
        ACCOUNTING_GROUP, JOB_STATUS,
        JOB_UNIVERSE, JOB_CURRENT_START_DATE, REMOTE_USER_CPU,
        REQUEST_MEMORY, RESIDENT_SET_SIZE,
        REQUEST_DISK, DISK_USAGE, REQUEST_CPUS,
        ASSIGNED_GPUS, GPUS_PROVISIONED, GPUS_USAGE, REQUEST_GPUS);

    public static final List<String> HELD_JOB = List.of(
        CLUSTER_ID, PROC_ID, OWNER,
        ACCOUNTING_GROUP, JOB_STATUS,
        JOB_UNIVERSE,
        REQUEST_GPUS,
        ENTERED_CURRENT_STATUS);

    public static final List<String> JOB_RESOURCES = List.of(RESIDENT_SET_SIZE_RAW, DISK_USAGE_RAW);

    public static final List<String> SLOT = List.of(
        SLOT_TYPE, STATE, NAME, SLOT_WEIGHT,
        CPUS, TOTAL_SLOT_CPUS, TOTAL_CPUS,
        DISK, TOTAL_SLOT_DISK, TOTAL_DISK,
        MEMORY, TOTAL_SLOT_MEMORY, TOTAL_MEMORY,
        GPUS, TOTAL_SLOT_GPUS, TOTAL_GPUS,
        LOAD_AVG, TOTAL_CONDOR_LOAD_AVG, TOTAL_LOAD_AVG,
        ACCOUNTING_GROUP, REMOTE_GROUP, REMOTE_OWNER,
        TOTAL_GPUS_USAGE, TOTAL_GPUS_USED_MEM, AVG_GPUS_USAGE, AVG_GPUS_USED_MEM,
        KFLOPS, IS_GLIDEIN);

    /**
     * AND an optional extra record predicate onto a base filter
     */
    public static String and(String filter, String extra) {
        if (extra == null || extra.isBlank() || ALL.equals(extra.trim())) {
            return filter;
        }
        return "(" + filter + ") && (" + extra + ")";
    }
}
