package com.sdu.metrics.metrics;

import com.sdu.metrics.memory.MemoryManager;
import com.sdu.metrics.metrics.cpu.ProcessCpuSource;

import java.lang.management.BufferPoolMXBean;
import java.lang.management.MemoryMXBean;

/**
 * {@link ExecutorMetricType}读取指标所需的运行时能力, 每个方法对应一个{@link MetricSourceType}.
 *
 * 能力不存在时抛出{@link MetricUnavailableException}, 由调用方决定默认值.
 *
 * @author hanhan.zhang
 * */
public interface MetricsContext {

    MemoryManager memoryManager() throws MetricUnavailableException;

    MemoryMXBean memoryBean() throws MetricUnavailableException;

    /**
     * @param name buffer pool name, e.g. "direct" or "mapped"
     * */
    BufferPoolMXBean bufferPool(String name) throws MetricUnavailableException;

    ProcessCpuSource processCpu() throws MetricUnavailableException;

}
