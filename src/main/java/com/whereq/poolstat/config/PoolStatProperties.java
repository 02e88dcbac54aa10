package com.whereq.poolstat.config;

import com.whereq.poolstat.classify.JobClassifier;
import com.whereq.poolstat.model.RetryPolicy;
import com.whereq.poolstat.query.QueryAttributes;
import com.whereq.poolstat.resource.SlotWeighting;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for WhereQ PoolStat.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "poolstat")
@Validated
@Data
public class PoolStatProperties {

    /**
     * Collector address of the pool to aggregate.
     */
    @NotBlank
    private String pool = "localhost";

    @Valid
    private BucketConfig buckets = new BucketConfig();

    @Valid
    private RetryConfig retry = new RetryConfig();

    @Valid
    private JobsConfig jobs = new JobsConfig();

    @Valid
    private SlotsConfig slots = new SlotsConfig();

    @Valid
    private QueryConfig query = new QueryConfig();

    @Valid
    private ScheduleConfig schedule = new ScheduleConfig();

    @Data
    public static class BucketConfig {
        /**
         * Base interval: anything younger is counted as "recent".
         */
        @NotNull
        private Duration interval = Duration.ofSeconds(60);
    }

    @Data
    public static class RetryConfig {
        /**
         * Attempts per source query, including the first.
         */
        @Min(1)
        private int maxRetries = 4;

        /**
         * Delay between attempts.
         */
        @NotNull
        private Duration delay = Duration.ofSeconds(30);

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .delay(delay)
                .build();
        }
    }

    @Data
    public static class JobsConfig {
        private boolean enabled = true;

        /**
         * Which schedulers to query.
         */
        @NotBlank
        private String scheddConstraint = QueryAttributes.ALL;

        /**
         * Extra job predicate, ANDed with each status filter.
         */
        private String constraint = QueryAttributes.ALL;

        /**
         * Matched-site value whose jobs are sited by resource name instead.
         */
        @NotBlank
        private String genericSite = JobClassifier.DEFAULT_GENERIC_SITE;

        /**
         * Schedulers queried at the same time.
         */
        @Min(1)
        private int maxConcurrentSources = 8;
    }

    @Data
    public static class SlotsConfig {
        private boolean enabled = true;

        /**
         * Which slots to query from the collector.
         */
        @NotBlank
        private String constraint = QueryAttributes.ALL;

        /**
         * Only report claimed-slot capacity as totals, not per group and owner.
         */
        private boolean totalsOnly = false;

        /**
         * Also sum memory and disk usage of running jobs across schedulers.
         */
        private boolean jobResources = true;

        @NotNull
        private SlotWeighting weighting = SlotWeighting.STANDARD;
    }

    @Data
    public static class QueryConfig {
        /**
         * Base URL of the pool query gateway.
         */
        @NotBlank
        private String gatewayUrl = "http://localhost:8090";

        /**
         * Per-request timeout; a timeout counts as a transient failure.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(60);
    }

    @Data
    public static class ScheduleConfig {
        /**
         * Run passes on a fixed rate.
         */
        private boolean enabled = false;

        /**
         * Time between pass starts.
         */
        @NotNull
        private Duration interval = Duration.ofMinutes(1);
    }
}
