package com.whereq.poolstat.resource;

import com.whereq.poolstat.model.Attributes;
import com.whereq.poolstat.model.StateRecord;

/**
 * How slot capacity converts to standard slots
 */
public enum SlotWeighting {

    /**
     * One standard slot is 1 CPU and 2000 MB of memory
     */
    STANDARD {
        @Override
        public double claimedWeight(StateRecord slot) {
            return Math.max(cpus(slot), Math.floor(memory(slot) / ResourceAccountant.MB_PER_STANDARD_SLOT));
        }

        @Override
        public double unclaimedWeight(StateRecord slot) {
            return Math.min(cpus(slot), Math.floor(memory(slot) / ResourceAccountant.MB_PER_STANDARD_SLOT));
        }

        @Override
        public boolean unusable(StateRecord slot) {
            return lacksCpuMemoryOrDisk(slot);
        }
    },

    /**
     * One standard slot is 1 GPU
     */
    GPU {
        @Override
        public double claimedWeight(StateRecord slot) {
            return slot.number(Attributes.GPUS, 1);
        }

        @Override
        public double unclaimedWeight(StateRecord slot) {
            return slot.number(Attributes.GPUS, 1);
        }

        @Override
        public boolean unusable(StateRecord slot) {
            return lacksCpuMemoryOrDisk(slot) || slot.number(Attributes.GPUS, 0) == 0;
        }
    };

    /**
     * Smallest disk, in KB, a new dynamic slot could be carved with
     */
    public static final double MIN_USABLE_DISK_KB = 1048576;

    /**
     * Standard slots occupied by a claimed slot
     */
    public abstract double claimedWeight(StateRecord slot);

    /**
     * Standard slots that still fit in a partitionable slot's free capacity
     */
    public abstract double unclaimedWeight(StateRecord slot);

    /**
     * Whether a partitionable slot is too depleted to carve another standard slot from
     */
    public abstract boolean unusable(StateRecord slot);

    private static double cpus(StateRecord slot) {
        return slot.number(Attributes.CPUS, 1);
    }

    private static double memory(StateRecord slot) {
        return slot.number(Attributes.MEMORY, 0);
    }

    private static boolean lacksCpuMemoryOrDisk(StateRecord slot) {
        return slot.number(Attributes.CPUS, 0) == 0
            || slot.number(Attributes.MEMORY, 0) < ResourceAccountant.MB_PER_STANDARD_SLOT
            || slot.number(Attributes.DISK, 0) < MIN_USABLE_DISK_KB;
    }
}
