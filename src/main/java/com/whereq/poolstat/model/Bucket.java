package com.whereq.poolstat.model;

import lombok.Value;

/**
 * One histogram bin: values strictly below the upper bound fall into it
 */
@Value
public class Bucket {

    /**
     * Exclusive upper bound, in seconds
     */
    long upperBound;

    String label;
}
