package com.sdu.metrics.scheduler;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.sdu.metrics.metrics.ExecutorMetricType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link ExecutorPeakMetricsTracker}职责:
 *
 * 1: 维护每个Executor的{@link PeakExecutorMetrics}, 生命周期:
 *
 *   1': {@link #register(String)}                   ==> Executor注册, 创建峰值记录(metrics[0] = -1)
 *
 *   2': {@link #compareAndUpdate(String, long[])}   ==> 采集线程上报指标快照, 更新峰值
 *
 *   3': {@link #reset(String)}                      ==> 重置峰值(如Stage切换)
 *
 *   4': {@link #remove(String)}                     ==> Executor注销, 删除峰值记录
 *
 * 2: 所有操作经{@link #lock}串行化, 读取返回拷贝, 调用方不持有内部数组引用
 *
 * @author hanhan.zhang
 * */
public class ExecutorPeakMetricsTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorPeakMetricsTracker.class);

    private final Object lock = new Object();

    // key = executorId, value = 指标峰值
    private final Map<String, PeakExecutorMetrics> executorPeakMetrics = Maps.newHashMap();

    public void register(String executorId) {
        synchronized (lock) {
            if (!executorPeakMetrics.containsKey(executorId)) {
                executorPeakMetrics.put(executorId, new PeakExecutorMetrics());
                LOGGER.info("Start tracking peak metrics of executor {}", executorId);
            }
        }
    }

    /**
     * Apply a snapshot to the executor's peak values, registering the executor on first sight.
     *
     * @return if there is a new peak value for any metric
     * */
    public boolean compareAndUpdate(String executorId, long[] executorMetrics) {
        synchronized (lock) {
            PeakExecutorMetrics peakMetrics = executorPeakMetrics.get(executorId);
            if (peakMetrics != null) {
                return peakMetrics.compareAndUpdate(executorMetrics);
            }
            // 快照校验通过后才注册
            peakMetrics = new PeakExecutorMetrics();
            boolean updated = peakMetrics.compareAndUpdate(executorMetrics);
            executorPeakMetrics.put(executorId, peakMetrics);
            LOGGER.info("Start tracking peak metrics of executor {}", executorId);
            return updated;
        }
    }

    public long[] peakMetrics(String executorId) {
        synchronized (lock) {
            return getOrThrow(executorId).getMetrics();
        }
    }

    public long peakMetric(String executorId, ExecutorMetricType metricType) {
        synchronized (lock) {
            return getOrThrow(executorId).getMetricValue(metricType);
        }
    }

    /**
     * @return metric name -> peak value, in metric index order
     * */
    public Map<String, Long> peakMetricsByName(String executorId) {
        long[] metrics = peakMetrics(executorId);
        Map<String, Long> namedMetrics = new LinkedHashMap<>();
        for (int i = 0; i < metrics.length; ++i) {
            namedMetrics.put(ExecutorMetricType.fromIndex(i).metricName(), metrics[i]);
        }
        return namedMetrics;
    }

    public void reset(String executorId) {
        synchronized (lock) {
            getOrThrow(executorId).reset();
        }
    }

    public boolean remove(String executorId) {
        synchronized (lock) {
            boolean removed = executorPeakMetrics.remove(executorId) != null;
            if (removed) {
                LOGGER.info("Stop tracking peak metrics of executor {}", executorId);
            }
            return removed;
        }
    }

    public boolean contains(String executorId) {
        synchronized (lock) {
            return executorPeakMetrics.containsKey(executorId);
        }
    }

    public ImmutableSet<String> executorIds() {
        synchronized (lock) {
            return ImmutableSet.copyOf(executorPeakMetrics.keySet());
        }
    }

    private PeakExecutorMetrics getOrThrow(String executorId) {
        PeakExecutorMetrics peakMetrics = executorPeakMetrics.get(executorId);
        if (peakMetrics == null) {
            throw new ExecutorNotFoundException(executorId);
        }
        return peakMetrics;
    }
}
