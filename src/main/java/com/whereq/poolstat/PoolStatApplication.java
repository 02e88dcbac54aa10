package com.whereq.poolstat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for WhereQ PoolStat.
 * This service aggregates the jobs and slots of a batch compute pool into
 * hierarchical counters and publishes them on a fixed rate.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@EnableScheduling
public class PoolStatApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoolStatApplication.class, args);
    }
}
