package com.whereq.poolstat.aggregate;

import com.whereq.poolstat.model.AccountingResult;
import com.whereq.poolstat.model.JobClassification;

import java.util.OptionalDouble;

/**
 * Folds one classified, accounted job into an aggregation table.
 *
 * Every metric prefix of the job gets its own counters. Efficiency, waste time and average
 * waste time are recomputed from that prefix's running sums after each update.
 */
public class JobMetricsFolder {

    public void fold(AggregationTable table, JobClassification classification, AccountingResult accounting) {
        for (String metric : classification.getMetricPrefixes()) {
            table.increment(metric + ".count");

            accounting.getBucketLabel()
                .ifPresent(label -> table.increment(metric + "." + label));

            if (accounting.hasEfficiencyInputs()) {
                table.add(metric + ".walltime", accounting.getWalltime());
                table.add(metric + ".cputime", accounting.getCputime());
                updateEfficiency(table, metric);
            }

            addIfPresent(table, metric + ".cpu_request", accounting.getCpuRequest());
            addIfPresent(table, metric + ".gpu_request", accounting.getGpuRequest());
            addIfPresent(table, metric + ".memory_request_b", accounting.getMemoryRequestBytes());
            addIfPresent(table, metric + ".disk_request_b", accounting.getDiskRequestBytes());
            table.add(metric + ".std_slots", accounting.getStdSlots());
            table.add(metric + ".std_slots_gpu", accounting.getStdSlotsGpu());

            addIfPresent(table, metric + ".gpus_usage", accounting.getGpusUsage());
            addIfPresent(table, metric + ".gpus_provisioned", accounting.getGpusProvisioned());
            addIfPresent(table, metric + ".memory_usage_b", accounting.getMemoryUsageBytes());
            addIfPresent(table, metric + ".disk_usage_b", accounting.getDiskUsageBytes());
        }
    }

    private static void updateEfficiency(AggregationTable table, String metric) {
        double walltime = table.get(metric + ".walltime");
        double cputime = table.get(metric + ".cputime");
        double wastetime = walltime - cputime;

        table.setDerived(metric + ".efficiency", clamp(cputime / walltime * 100.0));
        table.setDerived(metric + ".wastetime", wastetime);

        double count = table.get(metric + ".count");
        if (count > 0) {
            table.setDerived(metric + ".wastetime_avg", wastetime / count);
        }
    }

    static double clamp(double percent) {
        return Math.max(Math.min(percent, 100.0), 0.0);
    }

    private static void addIfPresent(AggregationTable table, String name, OptionalDouble value) {
        if (value.isPresent()) {
            table.add(name, value.getAsDouble());
        }
    }
}
