package com.whereq.poolstat.aggregate;

import com.whereq.poolstat.classify.SlotClassifier;
import com.whereq.poolstat.model.StateRecord;
import com.whereq.poolstat.resource.SlotWeighting;
import org.junit.jupiter.api.Test;

import static com.whereq.poolstat.model.TestRecords.job;
import static org.assertj.core.api.Assertions.assertThat;

class SlotMetricsFolderTest {

    private final SlotClassifier classifier = new SlotClassifier();

    private final StateRecord partitionable = job(
        "SlotType", "Partitionable", "State", "Unclaimed",
        "Cpus", 4L, "TotalCpus", 32L, "Memory", 8000L, "TotalMemory", 64000L,
        "Disk", 2_000_000L, "kflops", 2048L);

    private final StateRecord claimed = job(
        "SlotType", "Dynamic", "State", "Claimed",
        "AccountingGroup", "group_cms.bob@fnal.gov",
        "Cpus", 1L, "Memory", 6000L, "Disk", 500L, "SlotWeight", 3L, "kflops", 1024L);

    @Test
    void partitionableSlotSumsCapacity() {
        AggregationTable table = fold(new SlotMetricsFolder(SlotWeighting.STANDARD, false), partitionable);

        assertThat(table.get("Partitionable.totals.Cpus")).isEqualTo(4.0);
        assertThat(table.get("Partitionable.totals.TotalCpus")).isEqualTo(32.0);
        assertThat(table.get("Partitionable.Unclaimed.TotalMemory")).isEqualTo(64000.0);
        assertThat(table.get("Partitionable.totals.NumSlots")).isEqualTo(1.0);
        assertThat(table.get("Partitionable.totals.Mflops")).isEqualTo(8.0);
        assertThat(table.get("Partitionable.totals.StdSlots")).isEqualTo(4.0);
        assertThat(table.contains("Partitionable.totals.TotalGpus")).isTrue();
        assertThat(table.contains("Partitionable.unusable.Cpus")).isFalse();
    }

    @Test
    void depletedPartitionableSlotIsUnusable() {
        StateRecord depleted = job("SlotType", "Partitionable", "State", "Unclaimed",
            "Cpus", 0L, "Memory", 1000L, "Disk", 2_000_000L);

        AggregationTable table = fold(new SlotMetricsFolder(SlotWeighting.STANDARD, false), depleted);

        assertThat(table.get("Partitionable.unusable.Cpus")).isZero();
        assertThat(table.get("Partitionable.unusable.Memory")).isEqualTo(1000.0);
        assertThat(table.get("Partitionable.totals.StdSlots")).isZero();
    }

    @Test
    void claimedSlotIsCountedPerOwner() {
        AggregationTable table = fold(new SlotMetricsFolder(SlotWeighting.STANDARD, false), claimed);

        assertThat(table.get("Dynamic.Claimed.cms.bob.Memory")).isEqualTo(6000.0);
        assertThat(table.get("Dynamic.totals.Memory")).isEqualTo(6000.0);
        assertThat(table.get("Dynamic.totals.Mflops")).isEqualTo(1.0);
        assertThat(table.get("Dynamic.Claimed.cms.bob.Weighted")).isEqualTo(3.0);
        assertThat(table.get("Dynamic.Claimed.cms.bob.NumSlots")).isEqualTo(1.0);
        assertThat(table.get("Dynamic.Claimed.cms.bob.StdSlots")).isEqualTo(3.0);
    }

    @Test
    void totalsOnlySkipsOwnerCapacity() {
        AggregationTable table = fold(new SlotMetricsFolder(SlotWeighting.STANDARD, true), claimed);

        assertThat(table.contains("Dynamic.Claimed.cms.bob.Memory")).isFalse();
        assertThat(table.get("Dynamic.totals.Memory")).isEqualTo(6000.0);
        assertThat(table.get("Dynamic.Claimed.cms.bob.NumSlots")).isEqualTo(1.0);
    }

    @Test
    void gpuWeightingCountsGpus() {
        StateRecord gpuSlot = job("SlotType", "Dynamic", "State", "Claimed",
            "RemoteOwner", "alice@submit", "Cpus", 1L, "Memory", 4000L, "Gpus", 2L);

        AggregationTable table = fold(new SlotMetricsFolder(SlotWeighting.GPU, false), gpuSlot);

        assertThat(table.get("Dynamic.Claimed.Unknown.alice.StdSlots")).isEqualTo(2.0);
        assertThat(table.contains("Dynamic.Claimed.Unknown.alice.Weighted")).isFalse();
    }

    @Test
    void otherSlotsAreCountedPerState() {
        StateRecord idle = job("State", "Unclaimed", "Cpus", 2L, "Memory", 4000L);

        AggregationTable table = fold(new SlotMetricsFolder(SlotWeighting.STANDARD, false), idle);

        assertThat(table.get("Static.Unclaimed.Cpus")).isEqualTo(2.0);
        assertThat(table.get("Static.totals.Cpus")).isEqualTo(2.0);
        assertThat(table.get("Static.Unclaimed.NumSlots")).isEqualTo(1.0);
        assertThat(table.get("Static.totals.Mflops")).isZero();
    }

    @Test
    void mflopsUsesWholeCpusAndKflops() {
        assertThat(SlotMetricsFolder.mflops(job("Cpus", 3L, "kflops", 1000L))).isEqualTo(2L);
        assertThat(SlotMetricsFolder.mflops(job("kflops", 4096L))).isEqualTo(4L);
    }

    private AggregationTable fold(SlotMetricsFolder folder, StateRecord slot) {
        AggregationTable table = new AggregationTable();
        folder.fold(table, classifier.classify(slot), slot);
        return table;
    }
}
