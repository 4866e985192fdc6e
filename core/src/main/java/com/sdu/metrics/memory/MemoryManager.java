package com.sdu.metrics.memory;

import com.sdu.metrics.conf.MetricsConf;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 1: Executor Memory
 *
 *  +----------------------------------------+           +----------------------------------------+
 *  |             MaxHeapMemory              |           |            MaxOffHeapMemory            |
 *  +----------------------------------------+           +----------------------------------------+
 *  |  storage memory   |   execute memory   |           |  storage memory   |   execute memory   |
 *  +----------------------------------------+           +----------------------------------------+
 *
 *  MaxOffHeapMemory = spark.memory.offHeap.size
 *  非堆内存中Storage占比由spark.memory.storageFraction决定, 默认0.5
 *
 * 2: Executor Jvm 只存在一个 MemoryManager, 需保证线程安全(四个内存池共用同一把锁)
 *
 * 3: 指标采集通过{@link #onHeapExecutionMemoryUsed()}等读取各内存池使用量, 对应
 *    {@link com.sdu.metrics.metrics.ExecutorMetricType}中memory-manager类指标
 *
 * @author hanhan.zhang
 * */
public abstract class MemoryManager {

    protected final MetricsConf conf;
    // Storage内存存储量
    protected final long onHeapStorageMemory;
    // Execution计算内存存储量
    protected final long onHeapExecutionMemory;
    // 最大非堆内存存储量
    protected final long maxOffHeapMemory;
    // 非堆Storage内存存储量
    protected final long offHeapStorageMemory;

    protected final StorageMemoryPool onHeapStorageMemoryPool = new StorageMemoryPool(this, MemoryMode.ON_HEAP);
    protected final StorageMemoryPool offHeapStorageMemoryPool = new StorageMemoryPool(this, MemoryMode.OFF_HEAP);
    protected final ExecutionMemoryPool onHeapExecutionMemoryPool = new ExecutionMemoryPool(this, MemoryMode.ON_HEAP);
    protected final ExecutionMemoryPool offHeapExecutionMemoryPool = new ExecutionMemoryPool(this, MemoryMode.OFF_HEAP);

    public MemoryManager(MetricsConf conf, long onHeapStorageMemory, long onHeapExecutionMemory) {
        this.conf = conf;
        this.onHeapStorageMemory = onHeapStorageMemory;
        this.onHeapExecutionMemory = onHeapExecutionMemory;

        // 初始化jvm内存容量
        this.onHeapStorageMemoryPool.incrementPoolSize(this.onHeapStorageMemory);
        this.onHeapExecutionMemoryPool.incrementPoolSize(this.onHeapExecutionMemory);

        // 初始化DirectMemory容量
        this.maxOffHeapMemory = conf.getSizeAsBytes("spark.memory.offHeap.size", "0");
        this.offHeapStorageMemory = (long) (maxOffHeapMemory * conf.getDouble("spark.memory.storageFraction", 0.5));
        this.offHeapExecutionMemoryPool.incrementPoolSize(maxOffHeapMemory - offHeapStorageMemory);
        this.offHeapStorageMemoryPool.incrementPoolSize(offHeapStorageMemory);

        if (conf.getBoolean("spark.memory.offHeap.enabled", false)) {
            checkArgument(maxOffHeapMemory > 0,
                    "spark.memory.offHeap.size must be > 0 when spark.memory.offHeap.enabled == true");
        }
    }

    public abstract long maxOnHeapStorageMemory();
    public abstract long maxOffHeapStorageMemory();

    public abstract boolean acquireStorageMemory(String blockId, long numBytes, MemoryMode memoryMode);
    public synchronized void releaseStorageMemory(long numBytes, MemoryMode memoryMode) {
        storagePool(memoryMode).releaseMemory(numBytes);
    }
    public synchronized void releaseAllStorageMemory() {
        onHeapStorageMemoryPool.releaseAllMemory();
        offHeapStorageMemoryPool.releaseAllMemory();
    }

    public abstract long acquireExecutionMemory(long numBytes, long taskAttemptId, MemoryMode memoryMode);
    public synchronized void releaseExecutionMemory(long numBytes, long taskAttemptId, MemoryMode memoryMode) {
        executionPool(memoryMode).releaseMemory(numBytes, taskAttemptId);
    }
    public synchronized long releaseAllExecutionMemoryForTask(long taskAttemptId) {
        return onHeapExecutionMemoryPool.releaseAllMemoryForTask(taskAttemptId) +
                offHeapExecutionMemoryPool.releaseAllMemoryForTask(taskAttemptId);
    }

    /**
     * Returns the execution memory consumption, in bytes, for the given task.
     */
    public synchronized long getExecutionMemoryUsageForTask(long taskAttemptId) {
        return onHeapExecutionMemoryPool.getMemoryUsageForTask(taskAttemptId) +
                offHeapExecutionMemoryPool.getMemoryUsageForTask(taskAttemptId);
    }

    /*******************************内存池使用量******************************/
    public final synchronized long onHeapExecutionMemoryUsed() {
        return onHeapExecutionMemoryPool.memoryUsed();
    }

    public final synchronized long offHeapExecutionMemoryUsed() {
        return offHeapExecutionMemoryPool.memoryUsed();
    }

    public final synchronized long onHeapStorageMemoryUsed() {
        return onHeapStorageMemoryPool.memoryUsed();
    }

    public final synchronized long offHeapStorageMemoryUsed() {
        return offHeapStorageMemoryPool.memoryUsed();
    }

    public final synchronized long executionMemoryUsed() {
        return onHeapExecutionMemoryPool.memoryUsed() + offHeapExecutionMemoryPool.memoryUsed();
    }

    public final synchronized long storageMemoryUsed() {
        return onHeapStorageMemoryPool.memoryUsed() + offHeapStorageMemoryPool.memoryUsed();
    }

    protected final StorageMemoryPool storagePool(MemoryMode memoryMode) {
        switch (memoryMode) {
            case OFF_HEAP:
                return offHeapStorageMemoryPool;
            case ON_HEAP:
                return onHeapStorageMemoryPool;
            default:
                throw new IllegalArgumentException("Unsupported memory mode : " + memoryMode);
        }
    }

    protected final ExecutionMemoryPool executionPool(MemoryMode memoryMode) {
        switch (memoryMode) {
            case OFF_HEAP:
                return offHeapExecutionMemoryPool;
            case ON_HEAP:
                return onHeapExecutionMemoryPool;
            default:
                throw new IllegalArgumentException("Unsupported memory mode : " + memoryMode);
        }
    }
}
