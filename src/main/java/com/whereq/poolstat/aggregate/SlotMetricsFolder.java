package com.whereq.poolstat.aggregate;

import com.whereq.poolstat.model.Attributes;
import com.whereq.poolstat.model.SlotClassification;
import com.whereq.poolstat.model.StateRecord;
import com.whereq.poolstat.resource.SlotWeighting;

import java.util.List;

/**
 * Folds one classified slot into an aggregation table
 */
public class SlotMetricsFolder {

    static final List<String> PARTITIONABLE_KEYS = List.of(
        Attributes.TOTAL_DISK, Attributes.TOTAL_SLOT_DISK, Attributes.DISK,
        Attributes.TOTAL_MEMORY, Attributes.TOTAL_SLOT_MEMORY, Attributes.MEMORY,
        Attributes.TOTAL_CPUS, Attributes.TOTAL_SLOT_CPUS, Attributes.CPUS,
        Attributes.TOTAL_GPUS, Attributes.TOTAL_SLOT_GPUS, Attributes.GPUS,
        Attributes.TOTAL_GPUS_USAGE, Attributes.TOTAL_GPUS_USED_MEM,
        Attributes.AVG_GPUS_USAGE, Attributes.AVG_GPUS_USED_MEM,
        Attributes.TOTAL_LOAD_AVG, Attributes.LOAD_AVG, Attributes.TOTAL_CONDOR_LOAD_AVG);

    static final List<String> CLAIMED_KEYS = List.of(
        Attributes.DISK, Attributes.MEMORY, Attributes.CPUS, Attributes.GPUS,
        Attributes.LOAD_AVG, Attributes.TOTAL_GPUS_USAGE, Attributes.AVG_GPUS_USAGE);

    static final List<String> CAPACITY_KEYS = List.of(
        Attributes.DISK, Attributes.MEMORY, Attributes.CPUS, Attributes.GPUS);

    private final SlotWeighting weighting;
    private final boolean totalsOnly;

    /**
     * @param weighting standard-slot conversion
     * @param totalsOnly skip the per group/owner breakdown of claimed-slot capacity
     */
    public SlotMetricsFolder(SlotWeighting weighting, boolean totalsOnly) {
        this.weighting = weighting;
        this.totalsOnly = totalsOnly;
    }

    public void fold(AggregationTable table, SlotClassification classification, StateRecord slot) {
        switch (classification.getCategory()) {
            case PARTITIONABLE -> foldPartitionable(table, classification, slot);
            case CLAIMED -> foldClaimed(table, classification, slot);
            default -> foldOther(table, classification, slot);
        }
    }

    private void foldPartitionable(AggregationTable table, SlotClassification classification, StateRecord slot) {
        String totals = classification.totalsPrefix();
        for (String key : PARTITIONABLE_KEYS) {
            double value = slot.number(key, 0);
            table.add(totals + "." + key, value);
            table.add(classification.statePrefix() + "." + key, value);
        }
        table.increment(totals + ".NumSlots");
        table.add(totals + ".Mflops", mflops(slot));
        table.add(totals + ".StdSlots", weighting.unclaimedWeight(slot));

        if (weighting.unusable(slot)) {
            String unusable = classification.getSlotType() + ".unusable";
            for (String key : CAPACITY_KEYS) {
                table.add(unusable + "." + key, slot.number(key, 0));
            }
        }
    }

    private void foldClaimed(AggregationTable table, SlotClassification classification, StateRecord slot) {
        String totals = classification.totalsPrefix();
        String owner = classification.ownerPrefix();
        for (String key : CLAIMED_KEYS) {
            double value = slot.number(key, 0);
            if (!totalsOnly) {
                table.add(owner + "." + key, value);
            }
            table.add(totals + "." + key, value);
        }
        table.add(totals + ".Mflops", mflops(slot));

        slot.number(Attributes.SLOT_WEIGHT)
            .ifPresent(weight -> table.add(owner + ".Weighted", weight));
        table.increment(owner + ".NumSlots");
        table.add(owner + ".StdSlots", weighting.claimedWeight(slot));
    }

    private void foldOther(AggregationTable table, SlotClassification classification, StateRecord slot) {
        String totals = classification.totalsPrefix();
        String state = classification.statePrefix();
        for (String key : CAPACITY_KEYS) {
            double value = slot.number(key, 0);
            table.add(state + "." + key, value);
            table.add(totals + "." + key, value);
        }
        table.add(totals + ".Mflops", mflops(slot));
        table.increment(state + ".NumSlots");
    }

    /**
     * Floating-point rating of the slot's CPUs in Mflops
     */
    static long mflops(StateRecord slot) {
        long cpus = (long) slot.number(Attributes.CPUS, 1);
        long kflops = (long) slot.number(Attributes.KFLOPS, 0);
        return cpus * kflops / 1024;
    }
}
