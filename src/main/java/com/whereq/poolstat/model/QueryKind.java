package com.whereq.poolstat.model;

/**
 * What a single retry-protected fetch asks a source for
 */
public enum QueryKind {
    SOURCES("sources"),
    IDLE_JOBS("idle"),
    RUNNING_JOBS("running"),
    HELD_JOBS("held"),
    SLOTS("slots"),
    JOB_RESOURCES("job_resources");

    private final String label;

    QueryKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
