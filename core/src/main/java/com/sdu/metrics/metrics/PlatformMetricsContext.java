package com.sdu.metrics.metrics;

import com.google.common.collect.ImmutableMap;
import com.sdu.metrics.memory.MemoryManager;
import com.sdu.metrics.metrics.cpu.ProcessCpuSource;

import java.io.Closeable;
import java.io.IOException;
import java.lang.management.BufferPoolMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.List;

import static com.sdu.metrics.metrics.MetricSourceType.BUFFER_POOL_BEAN;
import static com.sdu.metrics.metrics.MetricSourceType.HEAP_BEAN;
import static com.sdu.metrics.metrics.MetricSourceType.MEMORY_MANAGER;
import static com.sdu.metrics.metrics.MetricSourceType.PROCESS_CPU;

/**
 * {@link MetricsContext}实现, 未设置的能力读取时抛出{@link MetricUnavailableException}.
 *
 * {@link #platform()}使用本进程MemoryMXBean及BufferPoolMXBean.
 *
 * @author hanhan.zhang
 * */
public class PlatformMetricsContext implements MetricsContext, Closeable {

    private final MemoryManager memoryManager;
    private final MemoryMXBean memoryBean;
    private final ImmutableMap<String, BufferPoolMXBean> bufferPools;
    private final ProcessCpuSource processCpu;

    private PlatformMetricsContext(Builder builder) {
        this.memoryManager = builder.memoryManager;
        this.memoryBean = builder.memoryBean;
        this.bufferPools = builder.bufferPools.buildKeepingLast();
        this.processCpu = builder.processCpu;
    }

    @Override
    public MemoryManager memoryManager() {
        if (memoryManager == null) {
            throw new MetricUnavailableException(MEMORY_MANAGER, "memory manager not set");
        }
        return memoryManager;
    }

    @Override
    public MemoryMXBean memoryBean() {
        if (memoryBean == null) {
            throw new MetricUnavailableException(HEAP_BEAN, "memory bean not set");
        }
        return memoryBean;
    }

    @Override
    public BufferPoolMXBean bufferPool(String name) {
        BufferPoolMXBean bean = bufferPools.get(name);
        if (bean == null) {
            throw new MetricUnavailableException(BUFFER_POOL_BEAN, "buffer pool '" + name + "' not exposed");
        }
        return bean;
    }

    @Override
    public ProcessCpuSource processCpu() {
        if (processCpu == null) {
            throw new MetricUnavailableException(PROCESS_CPU, "process cpu source not set");
        }
        return processCpu;
    }

    @Override
    public void close() throws IOException {
        if (processCpu instanceof Closeable) {
            ((Closeable) processCpu).close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder preloaded with the local platform memory and buffer pool beans.
     * */
    public static Builder platform() {
        return builder().memoryBean(ManagementFactory.getMemoryMXBean())
                        .bufferPools(ManagementFactory.getPlatformMXBeans(BufferPoolMXBean.class));
    }

    public static class Builder {
        private MemoryManager memoryManager;
        private MemoryMXBean memoryBean;
        private ImmutableMap.Builder<String, BufferPoolMXBean> bufferPools = ImmutableMap.builder();
        private ProcessCpuSource processCpu;

        private Builder() {}

        public Builder memoryManager(MemoryManager memoryManager) {
            this.memoryManager = memoryManager;
            return this;
        }

        public Builder memoryBean(MemoryMXBean memoryBean) {
            this.memoryBean = memoryBean;
            return this;
        }

        public Builder bufferPool(BufferPoolMXBean bufferPool) {
            this.bufferPools.put(bufferPool.getName(), bufferPool);
            return this;
        }

        public Builder bufferPools(List<BufferPoolMXBean> bufferPools) {
            bufferPools.forEach(this::bufferPool);
            return this;
        }

        public Builder processCpu(ProcessCpuSource processCpu) {
            this.processCpu = processCpu;
            return this;
        }

        public PlatformMetricsContext build() {
            return new PlatformMetricsContext(this);
        }
    }
}
