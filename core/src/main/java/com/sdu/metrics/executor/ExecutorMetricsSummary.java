package com.sdu.metrics.executor;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Map;

/**
 * Executor指标汇总, 由{@link ExecutorMetricsPoller#report()}生成, 供上报逻辑读取
 *
 * @author hanhan.zhang
 * */
@Getter
@AllArgsConstructor
public class ExecutorMetricsSummary implements Serializable {

    private final String executorId;
    // key = 指标名, value = 峰值(按指标下标排序)
    private final Map<String, Long> peakMetrics;
    private final float averageCpuUsage;
    private final float[] cpuUsages;
    // 最近一次采集时间, 尚未采集为-1
    private final long lastPollTime;

    @Override
    public String toString() {
        return "ExecutorMetricsSummary(" +
                "executorId='" + executorId + '\'' +
                ", peakMetrics=" + peakMetrics +
                ", averageCpuUsage=" + averageCpuUsage +
                ", cpuUsages=" + Arrays.toString(cpuUsages) +
                ", lastPollTime=" + lastPollTime +
                ')';
    }
}
