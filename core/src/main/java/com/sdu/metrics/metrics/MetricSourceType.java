package com.sdu.metrics.metrics;

/**
 * 指标读取所依赖的能力, 由{@link MetricsContext}提供
 *
 * @author hanhan.zhang
 * */
public enum MetricSourceType {

    /** {@link com.sdu.metrics.memory.MemoryManager}内存池计数 */
    MEMORY_MANAGER("memory-manager-counter"),

    /** {@link java.lang.management.MemoryMXBean}堆/非堆内存 */
    HEAP_BEAN("runtime-heap-bean"),

    /** {@link java.lang.management.BufferPoolMXBean}direct/mapped缓冲池 */
    BUFFER_POOL_BEAN("runtime-buffer-pool-bean"),

    /** {@link com.sdu.metrics.metrics.cpu.ProcessCpuSource}进程CPU时间 */
    PROCESS_CPU("os-process-cpu");

    private final String tag;

    MetricSourceType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
