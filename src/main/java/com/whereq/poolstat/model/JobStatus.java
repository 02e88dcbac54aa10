package com.whereq.poolstat.model;

/**
 * Job lifecycle class as seen by the aggregator
 *
 * Pool status codes:
 * 1 = IDLE, 2 = RUNNING, 5 = HELD, anything else (removed, completed, transferring, suspended) = UNKNOWN.
 * Jobs in the scheduler universe are classed as SCHEDULER regardless of status.
 */
public enum JobStatus {
    /**
     * Scheduler-universe job (DAG manager and similar)
     */
    SCHEDULER("dag"),

    /**
     * Waiting in the queue for a match
     */
    IDLE("idle"),

    /**
     * Matched and executing
     */
    RUNNING("running"),

    /**
     * On hold, will not run until released
     */
    HELD("held"),

    /**
     * Any other or missing status
     */
    UNKNOWN("unknown");

    public static final String STATUS_ATTRIBUTE = "JobStatus";
    public static final String UNIVERSE_ATTRIBUTE = "JobUniverse";

    public static final int IDLE_CODE = 1;
    public static final int RUNNING_CODE = 2;
    public static final int HELD_CODE = 5;
    public static final int SCHEDULER_UNIVERSE = 7;

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    /**
     * Name of this class inside metric names
     */
    public String label() {
        return label;
    }

    /**
     * Classify a job record. Never fails: an absent or malformed status is UNKNOWN.
     */
    public static JobStatus of(StateRecord job) {
        boolean schedulerUniverse = job.integer(UNIVERSE_ATTRIBUTE)
            .map(universe -> universe == SCHEDULER_UNIVERSE)
            .orElse(false);
        if (schedulerUniverse) {
            return SCHEDULER;
        }

        return lifecycleOf(job);
    }

    /**
     * Lifecycle class from the status code alone, ignoring the universe
     */
    public static JobStatus lifecycleOf(StateRecord job) {
        return job.integer(STATUS_ATTRIBUTE)
            .map(JobStatus::fromCode)
            .orElse(UNKNOWN);
    }

    public static JobStatus fromCode(long code) {
        if (code == IDLE_CODE) {
            return IDLE;
        } else if (code == RUNNING_CODE) {
            return RUNNING;
        } else if (code == HELD_CODE) {
            return HELD;
        }
        return UNKNOWN;
    }
}
