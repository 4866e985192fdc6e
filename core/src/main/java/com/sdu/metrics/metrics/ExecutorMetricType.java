package com.sdu.metrics.metrics;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.sdu.metrics.memory.MemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.ToLongFunction;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.sdu.metrics.metrics.MetricSourceType.BUFFER_POOL_BEAN;
import static com.sdu.metrics.metrics.MetricSourceType.HEAP_BEAN;
import static com.sdu.metrics.metrics.MetricSourceType.MEMORY_MANAGER;
import static com.sdu.metrics.metrics.MetricSourceType.PROCESS_CPU;

/**
 * Executor级别指标, 枚举顺序即指标在指标数组中的下标:
 *
 *  +-------+------------------------+--------------------------+
 *  | index |         metric         |          source          |
 *  +-------+------------------------+--------------------------+
 *  |   0   | JVMHeapMemory          | runtime-heap-bean        |
 *  |   1   | JVMOffHeapMemory       | runtime-heap-bean        |
 *  |  2~7  | On/OffHeap Execution、 | memory-manager-counter   |
 *  |       | Storage、Unified Memory |                          |
 *  |  8~9  | Direct/MappedPoolMemory| runtime-buffer-pool-bean |
 *  |  10   | CpuTime                | os-process-cpu           |
 *  +-------+------------------------+--------------------------+
 *
 * 下标在进程生命周期内固定, {@link #getCurrentMetrics(MetricsContext)}产生的快照及
 * {@link com.sdu.metrics.scheduler.PeakExecutorMetrics}均按此下标对齐.
 *
 * @author hanhan.zhang
 * */
public enum ExecutorMetricType {

    JVM_HEAP_MEMORY("JVMHeapMemory", HEAP_BEAN,
            context -> context.memoryBean().getHeapMemoryUsage().getUsed()),

    JVM_OFF_HEAP_MEMORY("JVMOffHeapMemory", HEAP_BEAN,
            context -> context.memoryBean().getNonHeapMemoryUsage().getUsed()),

    ON_HEAP_EXECUTION_MEMORY("OnHeapExecutionMemory", MEMORY_MANAGER,
            memoryManagerGetter(MemoryManager::onHeapExecutionMemoryUsed)),

    OFF_HEAP_EXECUTION_MEMORY("OffHeapExecutionMemory", MEMORY_MANAGER,
            memoryManagerGetter(MemoryManager::offHeapExecutionMemoryUsed)),

    ON_HEAP_STORAGE_MEMORY("OnHeapStorageMemory", MEMORY_MANAGER,
            memoryManagerGetter(MemoryManager::onHeapStorageMemoryUsed)),

    OFF_HEAP_STORAGE_MEMORY("OffHeapStorageMemory", MEMORY_MANAGER,
            memoryManagerGetter(MemoryManager::offHeapStorageMemoryUsed)),

    ON_HEAP_UNIFIED_MEMORY("OnHeapUnifiedMemory", MEMORY_MANAGER,
            memoryManagerGetter(m -> m.onHeapExecutionMemoryUsed() + m.onHeapStorageMemoryUsed())),

    OFF_HEAP_UNIFIED_MEMORY("OffHeapUnifiedMemory", MEMORY_MANAGER,
            memoryManagerGetter(m -> m.offHeapExecutionMemoryUsed() + m.offHeapStorageMemoryUsed())),

    DIRECT_POOL_MEMORY("DirectPoolMemory", BUFFER_POOL_BEAN,
            context -> context.bufferPool("direct").getMemoryUsed()),

    MAPPED_POOL_MEMORY("MappedPoolMemory", BUFFER_POOL_BEAN,
            context -> context.bufferPool("mapped").getMemoryUsed()),

    CPU_TIME("CpuTime", PROCESS_CPU,
            context -> context.processCpu().processCpuTime());

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorMetricType.class);

    private static final ExecutorMetricType[] VALUES = values();

    private static final ImmutableList<String> METRIC_NAMES;
    private static final ImmutableMap<String, ExecutorMetricType> NAME_TO_TYPE;

    static {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        ImmutableMap.Builder<String, ExecutorMetricType> nameToType = ImmutableMap.builder();
        for (ExecutorMetricType type : VALUES) {
            names.add(type.metricName);
            nameToType.put(type.metricName, type);
        }
        METRIC_NAMES = names.build();
        NAME_TO_TYPE = nameToType.build();
    }

    private final String metricName;
    private final MetricSourceType sourceType;
    private final MetricGetter getter;

    ExecutorMetricType(String metricName, MetricSourceType sourceType, MetricGetter getter) {
        this.metricName = metricName;
        this.sourceType = sourceType;
        this.getter = getter;
    }

    public String metricName() {
        return metricName;
    }

    public MetricSourceType sourceType() {
        return sourceType;
    }

    public int index() {
        return ordinal();
    }

    /**
     * Read the current value of this metric.
     *
     * @throws MetricUnavailableException if the context does not expose the required capability,
     *                                    or the capability reports no usable value
     * */
    public long getMetricValue(MetricsContext context) throws MetricUnavailableException {
        long value;
        try {
            value = getter.getMetricValue(context);
        } catch (MetricUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            // 如JDK-8207200: MemoryMXBean.getNonHeapMemoryUsage()抛出IllegalArgumentException
            throw new MetricUnavailableException(sourceType, metricName + " read failed: " + e, e);
        }
        if (value < 0) {
            throw new MetricUnavailableException(sourceType, metricName + " reported " + value);
        }
        return value;
    }

    /************************************指标目录*************************************/
    public static int numMetrics() {
        return VALUES.length;
    }

    public static ImmutableList<String> metricNames() {
        return METRIC_NAMES;
    }

    public static ExecutorMetricType fromIndex(int index) {
        checkElementIndex(index, VALUES.length, "metric index");
        return VALUES[index];
    }

    public static ExecutorMetricType fromName(String metricName) {
        ExecutorMetricType type = NAME_TO_TYPE.get(metricName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown executor metric: " + metricName);
        }
        return type;
    }

    /**
     * Take one snapshot of every metric, aligned with the enum order. A metric whose source is
     * unavailable is recorded as 0 so that the other metrics are still collected.
     * */
    public static long[] getCurrentMetrics(MetricsContext context) {
        long[] metrics = new long[VALUES.length];
        for (ExecutorMetricType type : VALUES) {
            try {
                metrics[type.ordinal()] = type.getMetricValue(context);
            } catch (MetricUnavailableException e) {
                LOGGER.debug("Metric {} unavailable, use 0: {}", type.metricName, e.getMessage());
                metrics[type.ordinal()] = 0L;
            }
        }
        return metrics;
    }

    @Override
    public String toString() {
        return metricName + "(" + ordinal() + ", " + sourceType.tag() + ")";
    }

    private static MetricGetter memoryManagerGetter(ToLongFunction<MemoryManager> f) {
        return context -> f.applyAsLong(context.memoryManager());
    }
}
