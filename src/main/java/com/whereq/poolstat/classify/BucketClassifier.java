package com.whereq.poolstat.classify;

import com.whereq.poolstat.model.Bucket;
import com.whereq.poolstat.model.BucketSchema;

/**
 * Maps an age or duration to a histogram bin
 */
public final class BucketClassifier {

    private BucketClassifier() {
    }

    /**
     * Label of the first bin whose bound is strictly greater than the value, else the catch-all.
     * Zero and negative values land in the first bin.
     */
    public static String classify(double value, BucketSchema schema) {
        for (Bucket bucket : schema.buckets()) {
            if (value < bucket.getUpperBound()) {
                return bucket.getLabel();
            }
        }
        return BucketSchema.CATCH_ALL;
    }
}
