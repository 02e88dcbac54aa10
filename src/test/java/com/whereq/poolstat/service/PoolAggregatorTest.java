package com.whereq.poolstat.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.whereq.poolstat.classify.JobClassifier;
import com.whereq.poolstat.classify.SlotClassifier;
import com.whereq.poolstat.config.PoolStatProperties;
import com.whereq.poolstat.exception.PoolQueryException;
import com.whereq.poolstat.exception.TransientQueryException;
import com.whereq.poolstat.model.BucketSchema;
import com.whereq.poolstat.model.PassKind;
import com.whereq.poolstat.model.PassStatus;
import com.whereq.poolstat.model.PoolSnapshot;
import com.whereq.poolstat.model.StateRecord;
import com.whereq.poolstat.resource.ResourceAccountant;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.whereq.poolstat.model.TestRecords.job;
import static com.whereq.poolstat.query.QueryAttributes.HELD_FILTER;
import static com.whereq.poolstat.query.QueryAttributes.IDLE_FILTER;
import static com.whereq.poolstat.query.QueryAttributes.RUNNING_FILTER;
import static com.whereq.poolstat.query.QueryAttributes.ALL;
import static org.assertj.core.api.Assertions.assertThat;

class PoolAggregatorTest {

    private static final long NOW = 1_700_000_000L;
    private static final String POOL = "collector.example.org";

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    private final FakePoolQueryService pool = new FakePoolQueryService();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final PoolStatProperties properties = new PoolStatProperties();

    private final Logger fetcherLogger = (Logger) LoggerFactory.getLogger(RecordFetcher.class);
    private final ListAppender<ILoggingEvent> logs = new ListAppender<>();

    @BeforeEach
    void setUp() {
        properties.setPool(POOL);
        properties.getRetry().setMaxRetries(2);
        properties.getRetry().setDelay(Duration.ofMillis(10));
        properties.getBuckets().setInterval(Duration.ofSeconds(30));

        logs.start();
        fetcherLogger.addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        fetcherLogger.detachAppender(logs);
    }

    @Test
    void exhaustedSourceDoesNotAbortThePass() {
        pool.schedds("schedd1", "schedd2")
            .answer("schedd1", HELD_FILTER, List.of(held("alice"), held("bob"), held("carol")))
            .fail("schedd2", HELD_FILTER, new TransientQueryException("connection refused"));

        PoolSnapshot snapshot = aggregator().aggregateJobs().block();

        assertThat(snapshot).isNotNull();
        assertThat(snapshot.get("totals.held.totals.count")).isEqualTo(3.0);
        assertThat(snapshot.getStatus()).isEqualTo(PassStatus.DEGRADED);
        assertThat(snapshot.getFailedSources()).containsExactly("schedd2/held");
        assertThat(snapshot.getRecordCount()).isEqualTo(3);
        assertThat(logs.list)
            .filteredOn(event -> event.getLevel() == Level.ERROR)
            .hasSize(1)
            .allMatch(event -> event.getFormattedMessage().contains("schedd2"));
        assertThat(pool.calls("schedd2", HELD_FILTER)).isEqualTo(2);
        assertThat(registry.get("poolstat.passes").tag("kind", "jobs").tag("status", "DEGRADED")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void completePassOverAllStatuses() {
        pool.schedds("schedd1")
            .answer("schedd1", IDLE_FILTER, List.of(job(
                "Owner", "alice", "AccountingGroup", "group_atlas.alice@fnal", "JobStatus", 1L, "QDate", NOW - 10)))
            .answer("schedd1", RUNNING_FILTER, List.of(job(
                "Owner", "bob", "AccountingGroup", "group_cms.prod", "JobStatus", 2L,
                "RequestCpus", 2L, "JobCurrentStartDate", NOW - 100, "RemoteUserCpu", 50L,
                "MATCH_GLIDEIN_Site", "CERN")));

        StepVerifier.create(aggregator().aggregateJobs())
            .assertNext(snapshot -> {
                assertThat(snapshot.getKind()).isEqualTo(PassKind.JOBS);
                assertThat(snapshot.getStatus()).isEqualTo(PassStatus.COMPLETE);
                assertThat(snapshot.getFailedSources()).isEmpty();
                assertThat(snapshot.get("totals.idle.totals.count")).isEqualTo(1.0);
                assertThat(snapshot.get("experiments.atlas.users.alice.idle.totals.count")).isEqualTo(1.0);
                assertThat(snapshot.get("experiments.atlas.users.alice.idle.totals.count_recent")).isEqualTo(1.0);
                assertThat(snapshot.getCounters().keySet())
                    .noneMatch(name -> name.startsWith("experiments.atlas.subgroups."));
                assertThat(snapshot.get("totals.running.sites.CERN.efficiency")).isEqualTo(25.0);
                assertThat(snapshot.get("experiments.cms.subgroups.prod..running.totals.wastetime")).isEqualTo(150.0);
                assertThat(snapshot.contains("totals.held.totals.count")).isFalse();
                assertThat(snapshot.getTakenAt()).isEqualTo(Instant.ofEpochSecond(NOW));
            })
            .verifyComplete();
    }

    @Test
    void extraJobConstraintIsAndedWithStatusFilter() {
        properties.getJobs().setConstraint("Owner == \"alice\"");
        String idle = "(" + IDLE_FILTER + ") && (Owner == \"alice\")";
        pool.schedds("schedd1").answer("schedd1", idle, List.of(job("Owner", "alice", "JobStatus", 1L)));

        PoolSnapshot snapshot = aggregator().aggregateJobs().block();

        assertThat(snapshot.get("users.alice.idle.totals.count")).isEqualTo(1.0);
        assertThat(pool.calls("schedd1", idle)).isEqualTo(1);
        assertThat(pool.calls("schedd1", IDLE_FILTER)).isZero();
    }

    @Test
    void noSchedulersMeansNoJobMetrics() {
        pool.sourcesFail(new TransientQueryException("collector down"));

        PoolSnapshot snapshot = aggregator().aggregateJobs().block();

        assertThat(snapshot.getStatus()).isEqualTo(PassStatus.FAILED);
        assertThat(snapshot.getCounters()).isEmpty();
    }

    @Test
    void sameInputGivesSameSnapshot() {
        pool.schedds("schedd2", "schedd1")
            .answer("schedd1", HELD_FILTER, List.of(held("alice")))
            .answer("schedd2", HELD_FILTER, List.of(held("bob")))
            .answer("schedd2", IDLE_FILTER, List.of(job("Owner", "bob", "JobStatus", 1L, "QDate", NOW - 5000)));

        PoolSnapshot first = aggregator().aggregateJobs().block();
        PoolSnapshot second = aggregator().aggregateJobs().block();

        assertThat(first.getCounters()).isEqualTo(second.getCounters());
        assertThat(first.get("totals.held.totals.count")).isEqualTo(2.0);
    }

    @Test
    void slotPassWithJobResources() {
        pool.schedds("schedd1")
            .answer(POOL, ALL, List.of(
                job("SlotType", "Partitionable", "State", "Unclaimed", "Cpus", 4L, "Memory", 8000L,
                    "Disk", 2_000_000L),
                job("SlotType", "Dynamic", "State", "Claimed", "RemoteOwner", "alice@submit",
                    "Cpus", 1L, "Memory", 2000L)))
            .answer("schedd1", RUNNING_FILTER, List.of(
                job("ResidentSetSize_RAW", 2048L, "DiskUsage_RAW", 500L),
                job("ResidentSetSize_RAW", 1024L, "DiskUsage_RAW", 100L)));

        PoolSnapshot snapshot = aggregator().aggregateSlots().block();

        assertThat(snapshot.getKind()).isEqualTo(PassKind.SLOTS);
        assertThat(snapshot.getStatus()).isEqualTo(PassStatus.COMPLETE);
        assertThat(snapshot.getRecordCount()).isEqualTo(2);
        assertThat(snapshot.get("Partitionable.totals.StdSlots")).isEqualTo(4.0);
        assertThat(snapshot.get("Dynamic.Claimed.Unknown.alice.NumSlots")).isEqualTo(1.0);
        assertThat(snapshot.get("jobs.totals.MemoryUsage")).isEqualTo(3.0);
        assertThat(snapshot.get("jobs.totals.DiskUsage")).isEqualTo(600.0);
    }

    @Test
    void jobResourcesCanBeTurnedOff() {
        properties.getSlots().setJobResources(false);
        pool.schedds("schedd1")
            .answer(POOL, ALL, List.of(job("State", "Unclaimed", "Cpus", 1L)));

        PoolSnapshot snapshot = aggregator().aggregateSlots().block();

        assertThat(snapshot.contains("jobs.totals.MemoryUsage")).isFalse();
        assertThat(pool.calls("schedd1", RUNNING_FILTER)).isZero();
    }

    @Test
    void failedSlotQueryFailsThePass() {
        pool.schedds("schedd1")
            .fail(POOL, ALL, new PoolQueryException("bad constraint"));

        PoolSnapshot snapshot = aggregator().aggregate(PassKind.SLOTS).block();

        assertThat(snapshot.getStatus()).isEqualTo(PassStatus.FAILED);
        assertThat(snapshot.getCounters()).isEmpty();
        assertThat(registry.get("poolstat.passes").tag("kind", "slots").tag("status", "FAILED")
            .counter().count()).isEqualTo(1.0);
    }

    @Test
    void failedJobResourceQueryDegradesSlotPass() {
        pool.schedds("schedd1")
            .answer(POOL, ALL, List.of(job("State", "Unclaimed", "Cpus", 1L)))
            .fail("schedd1", RUNNING_FILTER, new TransientQueryException("timeout"));

        PoolSnapshot snapshot = aggregator().aggregateSlots().block();

        assertThat(snapshot.getStatus()).isEqualTo(PassStatus.DEGRADED);
        assertThat(snapshot.getFailedSources()).containsExactly("schedd1/job_resources");
        assertThat(snapshot.get("Static.Unclaimed.NumSlots")).isEqualTo(1.0);
        assertThat(snapshot.get("jobs.totals.MemoryUsage")).isZero();
    }

    private PoolAggregator aggregator() {
        RecordFetcher fetcher = new RecordFetcher(pool, properties.getRetry().toPolicy(), registry);
        return new PoolAggregator(properties, fetcher, new JobClassifier(), new SlotClassifier(),
            new ResourceAccountant(clock), BucketSchema.standard(properties.getBuckets().getInterval()),
            clock, registry);
    }

    private static StateRecord held(String owner) {
        return job("Owner", owner, "JobStatus", 5L, "EnteredCurrentStatus", NOW - 600);
    }
}
