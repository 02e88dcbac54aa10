package com.whereq.poolstat.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable set of age bins with an implicit catch-all for values past the last bound.
 */
public final class BucketSchema {

    public static final String CATCH_ALL = "longer";

    private static final long HOUR = 3600;
    private static final long DAY = 24 * HOUR;

    private static final List<Bucket> STANDARD_BINS = List.of(
        new Bucket(HOUR, "one_hour"),
        new Bucket(4 * HOUR, "four_hours"),
        new Bucket(8 * HOUR, "eight_hours"),
        new Bucket(DAY, "one_day"),
        new Bucket(2 * DAY, "two_days"),
        new Bucket(7 * DAY, "one_week"));

    private final List<Bucket> buckets;

    public BucketSchema(List<Bucket> buckets) {
        if (buckets.isEmpty()) {
            throw new IllegalArgumentException("Bucket schema needs at least one bin");
        }
        for (int i = 1; i < buckets.size(); i++) {
            if (buckets.get(i).getUpperBound() <= buckets.get(i - 1).getUpperBound()) {
                throw new IllegalArgumentException("Bucket bounds must be strictly increasing: "
                    + buckets.get(i - 1) + " then " + buckets.get(i));
            }
        }
        this.buckets = List.copyOf(buckets);
    }

    /**
     * Pool schema: everything younger than the base interval is "recent", then hour/day/week bins.
     * Bins at or below the base interval could never be selected and are left out.
     */
    public static BucketSchema standard(Duration baseInterval) {
        long interval = baseInterval.getSeconds();
        if (interval <= 0) {
            throw new IllegalArgumentException("Base bucket interval must be positive: " + baseInterval);
        }

        List<Bucket> bins = new ArrayList<>();
        bins.add(new Bucket(interval, "recent"));
        for (Bucket bin : STANDARD_BINS) {
            if (bin.getUpperBound() > interval) {
                bins.add(bin);
            }
        }
        return new BucketSchema(bins);
    }

    public List<Bucket> buckets() {
        return buckets;
    }

    @Override
    public String toString() {
        return "BucketSchema" + buckets;
    }
}
