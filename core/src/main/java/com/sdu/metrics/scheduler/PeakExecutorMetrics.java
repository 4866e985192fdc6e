package com.sdu.metrics.scheduler;

import com.sdu.metrics.metrics.ExecutorMetricType;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Records the peak values for executor level metrics. If jvmUsedHeapMemory is -1, then no
 * values have been recorded yet.
 *
 * Not thread safe, access is guarded by {@link ExecutorPeakMetricsTracker}.
 *
 * @author hanhan.zhang
 * */
public class PeakExecutorMetrics {

    private static final long NOT_RECORDED = -1L;

    private final long[] metrics = new long[ExecutorMetricType.numMetrics()];

    public PeakExecutorMetrics() {
        metrics[0] = NOT_RECORDED;
    }

    /**
     * Compare the specified metric values with the saved peak executor metric values, and update
     * if there is a new peak value.
     *
     * @param executorMetrics the executor metrics to compare, indexed by {@link ExecutorMetricType#index()}
     * @return if there is a new peak value for any metric
     */
    public boolean compareAndUpdate(long[] executorMetrics) {
        checkNotNull(executorMetrics, "executor metrics");
        checkArgument(executorMetrics.length == metrics.length,
                      "executor metrics length %s does not match metric types %s",
                      executorMetrics.length, metrics.length);

        boolean updated = false;
        for (int metricIdx = 0; metricIdx < metrics.length; ++metricIdx) {
            long newVal = executorMetrics[metricIdx];
            if (newVal > metrics[metricIdx]) {
                updated = true;
                metrics[metricIdx] = newVal;
            }
        }
        return updated;
    }

    /** Clears/resets the saved peak values. */
    public void reset() {
        Arrays.fill(metrics, 0L);
        metrics[0] = NOT_RECORDED;
    }

    public boolean isRecorded() {
        return metrics[0] != NOT_RECORDED;
    }

    public long getMetricValue(ExecutorMetricType metricType) {
        return metrics[metricType.index()];
    }

    public long[] getMetrics() {
        return metrics.clone();
    }

    @Override
    public String toString() {
        return "PeakExecutorMetrics(" + Arrays.toString(metrics) + ")";
    }
}
