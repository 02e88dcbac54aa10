package com.whereq.poolstat.model;

/**
 * Kind of daemon a source reference points at
 */
public enum SourceType {
    /**
     * Pool collector (slot advertisements)
     */
    COLLECTOR,

    /**
     * Job queue scheduler
     */
    SCHEDD,

    /**
     * Execution host daemon
     */
    STARTD
}
