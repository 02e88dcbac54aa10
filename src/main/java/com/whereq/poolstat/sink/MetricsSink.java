package com.whereq.poolstat.sink;

import com.whereq.poolstat.model.PoolSnapshot;

/**
 * Destination for published pool snapshots
 */
public interface MetricsSink {

    /**
     * Receive one finished snapshot. Implementations must not block for long;
     * they are called on the thread that ran the pass.
     */
    void accept(PoolSnapshot snapshot);
}
