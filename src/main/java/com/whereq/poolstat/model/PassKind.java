package com.whereq.poolstat.model;

import java.util.Locale;

/**
 * Record family an aggregation pass covers
 */
public enum PassKind {
    JOBS,
    SLOTS;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PassKind fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}
