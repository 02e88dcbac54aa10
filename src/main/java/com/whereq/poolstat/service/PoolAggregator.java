package com.whereq.poolstat.service;

import com.whereq.poolstat.aggregate.AggregationTable;
import com.whereq.poolstat.aggregate.JobMetricsFolder;
import com.whereq.poolstat.aggregate.SlotMetricsFolder;
import com.whereq.poolstat.classify.JobClassifier;
import com.whereq.poolstat.classify.SlotClassifier;
import com.whereq.poolstat.config.PoolStatProperties;
import com.whereq.poolstat.model.Attributes;
import com.whereq.poolstat.model.BucketSchema;
import com.whereq.poolstat.model.FetchResult;
import com.whereq.poolstat.model.PassKind;
import com.whereq.poolstat.model.PassStatus;
import com.whereq.poolstat.model.PoolSnapshot;
import com.whereq.poolstat.model.QueryKind;
import com.whereq.poolstat.model.SourceRef;
import com.whereq.poolstat.model.SourceType;
import com.whereq.poolstat.model.StateRecord;
import com.whereq.poolstat.resource.ResourceAccountant;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.whereq.poolstat.query.QueryAttributes.*;

/**
 * Runs aggregation passes over a pool
 *
 * Fetches fan out: one retry-protected query per (source, record family), run concurrently.
 * Folding fans in: all fetched records go through classification, accounting and folding
 * into a single table on one thread, in a fixed source order.
 */
@Slf4j
public class PoolAggregator {

    public static final String JOB_MEMORY_USAGE = "jobs.totals.MemoryUsage";
    public static final String JOB_DISK_USAGE = "jobs.totals.DiskUsage";

    private static final Comparator<FetchResult<?>> FOLD_ORDER =
        Comparator.comparing((FetchResult<?> result) -> result.getSource())
            .thenComparing(result -> result.getKind());

    private final PoolStatProperties properties;
    private final RecordFetcher fetcher;
    private final JobClassifier jobClassifier;
    private final SlotClassifier slotClassifier;
    private final ResourceAccountant accountant;
    private final BucketSchema bucketSchema;
    private final JobMetricsFolder jobFolder;
    private final SlotMetricsFolder slotFolder;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public PoolAggregator(PoolStatProperties properties,
                          RecordFetcher fetcher,
                          JobClassifier jobClassifier,
                          SlotClassifier slotClassifier,
                          ResourceAccountant accountant,
                          BucketSchema bucketSchema,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.jobClassifier = jobClassifier;
        this.slotClassifier = slotClassifier;
        this.accountant = accountant;
        this.bucketSchema = bucketSchema;
        this.jobFolder = new JobMetricsFolder();
        this.slotFolder = new SlotMetricsFolder(properties.getSlots().getWeighting(),
            properties.getSlots().isTotalsOnly());
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run one pass of the requested kind
     */
    public Mono<PoolSnapshot> aggregate(PassKind kind) {
        return kind == PassKind.JOBS ? aggregateJobs() : aggregateSlots();
    }

    /**
     * Count idle, running and held jobs on every selected scheduler
     *
     * @return Mono with the job counters; never errors
     */
    public Mono<PoolSnapshot> aggregateJobs() {
        String pool = properties.getPool();
        PoolStatProperties.JobsConfig jobs = properties.getJobs();
        Timer.Sample sample = Timer.start(meterRegistry);

        return fetcher.fetchSources(pool, SourceType.SCHEDD, jobs.getScheddConstraint())
            .flatMap(sources -> {
                if (sources.isFailed()) {
                    log.error("Trouble getting pool {} schedds, no job metrics this pass.", pool);
                    return Mono.just(PoolSnapshot.failed(PassKind.JOBS, clock.instant()));
                }
                log.debug("Querying {} schedds in pool {}", sources.getRecords().size(), pool);
                return Flux.fromIterable(sources.getRecords())
                    .flatMap(this::fetchJobs, jobs.getMaxConcurrentSources())
                    .collectList()
                    .map(this::foldJobs);
            })
            .doOnNext(snapshot -> recordPass(sample, snapshot));
    }

    /**
     * Sum slot capacity and usage from the collector, plus job resource usage when enabled
     *
     * @return Mono with the slot counters; never errors
     */
    public Mono<PoolSnapshot> aggregateSlots() {
        String pool = properties.getPool();
        PoolStatProperties.SlotsConfig slots = properties.getSlots();
        Timer.Sample sample = Timer.start(meterRegistry);

        Mono<FetchResult<StateRecord>> slotRecords =
            fetcher.fetch(SourceRef.collector(pool), QueryKind.SLOTS, slots.getConstraint(), SLOT);
        Mono<List<FetchResult<StateRecord>>> jobResources = slots.isJobResources()
            ? fetchJobResources()
            : Mono.just(List.of());

        return Mono.zip(slotRecords, jobResources)
            .map(fetched -> {
                if (fetched.getT1().isFailed()) {
                    log.error("Trouble getting pool {} startds, no slot metrics this pass.", pool);
                    return PoolSnapshot.failed(PassKind.SLOTS, clock.instant());
                }
                return foldSlots(fetched.getT1(), fetched.getT2());
            })
            .doOnNext(snapshot -> recordPass(sample, snapshot));
    }

    private Flux<FetchResult<StateRecord>> fetchJobs(SourceRef schedd) {
        String extra = properties.getJobs().getConstraint();
        return Flux.merge(
            fetcher.fetch(schedd, QueryKind.IDLE_JOBS, and(IDLE_FILTER, extra), IDLE_JOB),
            fetcher.fetch(schedd, QueryKind.RUNNING_JOBS, and(RUNNING_FILTER, extra), RUNNING_JOB),
            fetcher.fetch(schedd, QueryKind.HELD_JOBS, and(HELD_FILTER, extra), HELD_JOB));
    }

    private Mono<List<FetchResult<StateRecord>>> fetchJobResources() {
        String pool = properties.getPool();
        return fetcher.fetchSources(pool, SourceType.SCHEDD, properties.getJobs().getScheddConstraint())
            .flatMap(sources -> {
                if (sources.isFailed()) {
                    return Mono.just(List.of(FetchResult.<StateRecord>failure(pool, QueryKind.SOURCES)));
                }
                return Flux.fromIterable(sources.getRecords())
                    .flatMap(schedd -> fetcher.fetch(schedd, QueryKind.JOB_RESOURCES, RUNNING_FILTER, JOB_RESOURCES),
                        properties.getJobs().getMaxConcurrentSources())
                    .collectList();
            });
    }

    private PoolSnapshot foldJobs(List<FetchResult<StateRecord>> fetched) {
        AggregationTable table = new AggregationTable();
        List<FetchResult<StateRecord>> ordered = new ArrayList<>(fetched);
        ordered.sort(FOLD_ORDER);

        long records = 0;
        for (FetchResult<StateRecord> result : ordered) {
            for (StateRecord job : result.getRecords()) {
                try {
                    jobFolder.fold(table, jobClassifier.classify(job), accountant.account(job, bucketSchema));
                    records++;
                } catch (RuntimeException e) {
                    log.error("Skipping job {}.{} from {}: {}", job.get(Attributes.CLUSTER_ID).orElse("?"),
                        job.get(Attributes.PROC_ID).orElse("?"), result.getSource(), e.getMessage(), e);
                }
            }
        }
        return snapshot(PassKind.JOBS, table, ordered, records);
    }

    private PoolSnapshot foldSlots(FetchResult<StateRecord> slots, List<FetchResult<StateRecord>> jobResources) {
        AggregationTable table = new AggregationTable();

        long records = 0;
        for (StateRecord slot : slots.getRecords()) {
            try {
                slotFolder.fold(table, slotClassifier.classify(slot), slot);
                records++;
            } catch (RuntimeException e) {
                log.error("Skipping slot {}: {}", slot.get(Attributes.NAME).orElse("?"), e.getMessage(), e);
            }
        }

        if (properties.getSlots().isJobResources()) {
            foldJobResources(table, jobResources);
        }

        List<FetchResult<StateRecord>> all = new ArrayList<>(jobResources);
        all.add(slots);
        all.sort(FOLD_ORDER);
        return snapshot(PassKind.SLOTS, table, all, records);
    }

    /**
     * Resident memory (KB, reported as MB) and disk usage (KB) of all running jobs
     */
    private void foldJobResources(AggregationTable table, List<FetchResult<StateRecord>> jobResources) {
        boolean listed = jobResources.stream().noneMatch(result -> result.getKind() == QueryKind.SOURCES);
        if (!listed) {
            return;
        }

        double memoryKB = 0;
        double diskKB = 0;
        for (FetchResult<StateRecord> result : jobResources) {
            for (StateRecord job : result.getRecords()) {
                memoryKB += job.number(Attributes.RESIDENT_SET_SIZE_RAW, 0);
                diskKB += job.number(Attributes.DISK_USAGE_RAW, 0);
            }
        }
        table.setDerived(JOB_MEMORY_USAGE, memoryKB / 1024);
        table.setDerived(JOB_DISK_USAGE, diskKB);
    }

    private PoolSnapshot snapshot(PassKind kind, AggregationTable table, List<FetchResult<StateRecord>> fetched,
                                  long records) {
        List<String> failed = fetched.stream()
            .filter(FetchResult::isFailed)
            .map(FetchResult::label)
            .toList();

        PoolSnapshot snapshot = PoolSnapshot.builder()
            .kind(kind)
            .status(failed.isEmpty() ? PassStatus.COMPLETE : PassStatus.DEGRADED)
            .counters(table.snapshot())
            .failedSources(failed)
            .recordCount(records)
            .takenAt(clock.instant())
            .build();

        if (!failed.isEmpty()) {
            log.warn("{} pass is missing data from {} queries: {}", kind.label(), failed.size(), failed);
        }
        return snapshot;
    }

    private void recordPass(Timer.Sample sample, PoolSnapshot snapshot) {
        String kind = snapshot.getKind().label();
        long elapsed = sample.stop(Timer.builder("poolstat.pass.time")
            .description("Aggregation pass time")
            .tag("kind", kind)
            .register(meterRegistry));

        log.info("Processed {} {} records into {} counters in {} ms, {} failed queries, status {}",
            snapshot.getRecordCount(), kind, snapshot.getCounters().size(),
            TimeUnit.NANOSECONDS.toMillis(elapsed), snapshot.getFailedSources().size(), snapshot.getStatus());

        Counter.builder("poolstat.passes")
            .description("Number of aggregation passes")
            .tag("kind", kind)
            .tag("status", snapshot.getStatus().name())
            .register(meterRegistry)
            .increment();
    }
}
