package com.whereq.poolstat.resource;

import com.whereq.poolstat.classify.BucketClassifier;
import com.whereq.poolstat.model.AccountingResult;
import com.whereq.poolstat.model.Attributes;
import com.whereq.poolstat.model.BucketSchema;
import com.whereq.poolstat.model.JobStatus;
import com.whereq.poolstat.model.StateRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Calculate resource requests, usage and run times for a job record
 *
 * One standard slot is 1 CPU and 2000 MB of memory (disk unspecified);
 * one standard GPU slot is 1 GPU.
 */
@Slf4j
public class ResourceAccountant {

    public static final double MB_PER_STANDARD_SLOT = 2000.0;

    private static final double KB = 1024.0;
    private static final double MB = 1024.0 * 1024.0;

    private final Clock clock;

    public ResourceAccountant(Clock clock) {
        this.clock = clock;
    }

    /**
     * Account a job record against a bucket schema
     *
     * @param job the job record
     * @param schema bins for queue age, walltime and hold age
     * @return derived quantities; unreadable fields are left empty
     */
    public AccountingResult account(StateRecord job, BucketSchema schema) {
        long now = clock.instant().getEpochSecond();
        JobStatus lifecycle = JobStatus.lifecycleOf(job);

        double walltime = walltime(job, now);
        AccountingResult.AccountingResultBuilder result = AccountingResult.builder()
            .bucketLabel(bucketLabel(job, lifecycle, walltime, now, schema))
            .walltime(walltime)
            .cputime(job.number(Attributes.REMOTE_USER_CPU, 0));

        double stdSlots = 1;
        OptionalDouble cpus = requested(job, Attributes.REQUEST_CPUS);
        if (cpus.isPresent()) {
            result.cpuRequest(cpus);
            stdSlots = Math.max(stdSlots, cpus.getAsDouble());
        }

        OptionalDouble memoryMB = requested(job, Attributes.REQUEST_MEMORY);
        if (memoryMB.isPresent()) {
            result.memoryRequestBytes(OptionalDouble.of(memoryMB.getAsDouble() * MB));
            stdSlots = Math.max(stdSlots, memoryMB.getAsDouble() / MB_PER_STANDARD_SLOT);
        }

        OptionalDouble diskKB = requested(job, Attributes.REQUEST_DISK);
        if (diskKB.isPresent()) {
            result.diskRequestBytes(OptionalDouble.of(diskKB.getAsDouble() * KB));
        }

        double stdSlotsGpu = 0;
        if (job.has(Attributes.REQUEST_GPUS)) {
            OptionalDouble gpus = requested(job, Attributes.REQUEST_GPUS);
            if (gpus.isPresent()) {
                result.gpuRequest(gpus);
                stdSlotsGpu = Math.max(1, gpus.getAsDouble());
            } else {
                // requested, amount unknown
                stdSlotsGpu = 1;
            }
        }

        result.stdSlots(stdSlots).stdSlotsGpu(stdSlotsGpu);

        if (lifecycle == JobStatus.RUNNING) {
            result.gpusUsage(requested(job, Attributes.GPUS_USAGE))
                .gpusProvisioned(requested(job, Attributes.GPUS_PROVISIONED))
                .memoryUsageBytes(scaled(requested(job, Attributes.RESIDENT_SET_SIZE), KB))
                .diskUsageBytes(scaled(requested(job, Attributes.DISK_USAGE), KB));
        }

        return result.build();
    }

    /**
     * Elapsed time since the current start, multiplied by requested CPUs.
     * A missing start date counts as "now"; a missing or unevaluable CPU request counts as 1.
     */
    public double walltime(StateRecord job, long now) {
        double start = job.number(Attributes.JOB_CURRENT_START_DATE, now);
        double cpus = job.number(Attributes.REQUEST_CPUS, 1);
        return (now - start) * cpus;
    }

    private Optional<String> bucketLabel(StateRecord job, JobStatus lifecycle, double walltime, long now,
                                         BucketSchema schema) {
        return switch (lifecycle) {
            case IDLE -> Optional.of(job.number(Attributes.QUEUE_DATE)
                .map(queued -> "count_" + BucketClassifier.classify(now - queued, schema))
                .orElse("count_unknown"));
            case RUNNING -> Optional.of(walltime > 0
                ? "count_" + BucketClassifier.classify(walltime, schema)
                : "count_unknown");
            case HELD -> Optional.of(job.number(Attributes.ENTERED_CURRENT_STATUS)
                .map(entered -> "count_holdage_" + BucketClassifier.classify(now - entered, schema))
                .orElse("count_holdage_unknown"));
            default -> Optional.empty();
        };
    }

    /**
     * Numeric attribute, empty when absent or when it doesn't evaluate to a number
     */
    private OptionalDouble requested(StateRecord job, String key) {
        Optional<Double> value = job.number(key);
        if (value.isEmpty()) {
            if (job.has(key)) {
                log.debug("Skipping {}: value {} does not evaluate to a number", key, job.get(key).orElse(null));
            }
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value.get());
    }

    private static OptionalDouble scaled(OptionalDouble value, double factor) {
        return value.isPresent() ? OptionalDouble.of(value.getAsDouble() * factor) : OptionalDouble.empty();
    }
}
