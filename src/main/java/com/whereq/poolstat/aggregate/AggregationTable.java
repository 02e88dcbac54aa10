package com.whereq.poolstat.aggregate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metric name to value mapping built up during one aggregation pass.
 *
 * Counters are summed with {@link #add}; derived values (ratios, averages) are overwritten with
 * {@link #setDerived} after the counters they depend on change. Names are not validated.
 * Not thread-safe: one pass folds records into its table from a single thread.
 */
public class AggregationTable {

    private final Map<String, Double> values = new HashMap<>();

    /**
     * Add to a counter, creating it at zero if absent
     */
    public void add(String name, double amount) {
        values.merge(name, amount, Double::sum);
    }

    public void increment(String name) {
        add(name, 1);
    }

    /**
     * Overwrite a derived value
     */
    public void setDerived(String name, double value) {
        values.put(name, value);
    }

    public double get(String name) {
        return values.getOrDefault(name, 0.0);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }

    /**
     * Sorted, unmodifiable copy of the current contents
     */
    public Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(values));
    }
}
