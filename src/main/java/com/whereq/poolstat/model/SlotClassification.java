package com.whereq.poolstat.model;

import lombok.Builder;
import lombok.Value;

/**
 * Which slot rollups a slot record contributes to
 */
@Value
@Builder
public class SlotClassification {

    public enum Category {
        /**
         * Partitionable parent slot; its capacity figures are summed as-is
         */
        PARTITIONABLE,

        /**
         * Claimed slot, counted per accounting group and owner
         */
        CLAIMED,

        /**
         * Any other static or dynamic slot, counted per state
         */
        OTHER
    }

    /**
     * Slot type, with "Glidein" appended for glidein slots, e.g. "PartitionableGlidein"
     */
    String slotType;

    /**
     * Slot state, "Unknown" when absent
     */
    String state;

    Category category;

    /**
     * Sanitized accounting group of the occupying job, claimed slots only
     */
    String group;

    /**
     * Sanitized owner of the occupying job, claimed slots only
     */
    String owner;

    /**
     * "&lt;type&gt;.totals"
     */
    public String totalsPrefix() {
        return slotType + ".totals";
    }

    /**
     * "&lt;type&gt;.&lt;state&gt;"
     */
    public String statePrefix() {
        return slotType + "." + state;
    }

    /**
     * "&lt;type&gt;.&lt;state&gt;.&lt;group&gt;.&lt;owner&gt;"
     */
    public String ownerPrefix() {
        return String.join(".", slotType, state, group, owner);
    }
}
