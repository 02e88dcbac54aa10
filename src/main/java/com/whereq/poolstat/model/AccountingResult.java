package com.whereq.poolstat.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Derived resource quantities for one job record.
 *
 * Request and usage figures are empty when the attribute is absent or failed to evaluate;
 * such a field contributes nothing while the rest of the record is still counted.
 */
@Value
@Builder
public class AccountingResult {

    /**
     * Age or walltime bin, e.g. "count_recent" or "count_holdage_unknown"; empty for statuses that aren't binned
     */
    @Builder.Default
    Optional<String> bucketLabel = Optional.empty();

    /**
     * Elapsed run time multiplied by requested CPUs (CPU-seconds equivalent)
     */
    double walltime;

    /**
     * Reported remote CPU seconds
     */
    double cputime;

    /**
     * Standard slots: max(1, cpus, memoryMB / 2000)
     */
    double stdSlots;

    /**
     * Standard GPU slots: 0 without a RequestGpus attribute, else max(1, gpus)
     */
    double stdSlotsGpu;

    @Builder.Default
    OptionalDouble cpuRequest = OptionalDouble.empty();

    @Builder.Default
    OptionalDouble memoryRequestBytes = OptionalDouble.empty();

    @Builder.Default
    OptionalDouble diskRequestBytes = OptionalDouble.empty();

    @Builder.Default
    OptionalDouble gpuRequest = OptionalDouble.empty();

    // Observed usage, running jobs only

    @Builder.Default
    OptionalDouble gpusUsage = OptionalDouble.empty();

    @Builder.Default
    OptionalDouble gpusProvisioned = OptionalDouble.empty();

    @Builder.Default
    OptionalDouble memoryUsageBytes = OptionalDouble.empty();

    @Builder.Default
    OptionalDouble diskUsageBytes = OptionalDouble.empty();

    /**
     * Walltime and cputime only feed the efficiency family when both are positive
     */
    public boolean hasEfficiencyInputs() {
        return walltime > 0 && cputime > 0;
    }
}
