package com.whereq.poolstat.config;

import com.whereq.poolstat.classify.JobClassifier;
import com.whereq.poolstat.classify.SlotClassifier;
import com.whereq.poolstat.model.BucketSchema;
import com.whereq.poolstat.query.PoolQueryService;
import com.whereq.poolstat.resource.ResourceAccountant;
import com.whereq.poolstat.service.PoolAggregator;
import com.whereq.poolstat.service.RecordFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the classification and aggregation pipeline from {@link PoolStatProperties}.
 *
 * @author WhereQ Inc.
 */
@Configuration
@Slf4j
public class AggregationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BucketSchema bucketSchema(PoolStatProperties properties) {
        BucketSchema schema = BucketSchema.standard(properties.getBuckets().getInterval());
        log.info("Using {}", schema);
        return schema;
    }

    @Bean
    public JobClassifier jobClassifier(PoolStatProperties properties) {
        return new JobClassifier(properties.getJobs().getGenericSite());
    }

    @Bean
    public SlotClassifier slotClassifier() {
        return new SlotClassifier();
    }

    @Bean
    public ResourceAccountant resourceAccountant(Clock clock) {
        return new ResourceAccountant(clock);
    }

    @Bean
    public RecordFetcher recordFetcher(PoolQueryService queryService, PoolStatProperties properties,
                                       MeterRegistry meterRegistry) {
        return new RecordFetcher(queryService, properties.getRetry().toPolicy(), meterRegistry);
    }

    @Bean
    public PoolAggregator poolAggregator(PoolStatProperties properties,
                                         RecordFetcher recordFetcher,
                                         JobClassifier jobClassifier,
                                         SlotClassifier slotClassifier,
                                         ResourceAccountant resourceAccountant,
                                         BucketSchema bucketSchema,
                                         Clock clock,
                                         MeterRegistry meterRegistry) {
        return new PoolAggregator(properties, recordFetcher, jobClassifier, slotClassifier,
            resourceAccountant, bucketSchema, clock, meterRegistry);
    }
}
