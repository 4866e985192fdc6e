package com.sdu.metrics.memory;

import com.sdu.metrics.conf.MetricsConf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 不支持动态调整Storage和Execution内存, 非堆内存全部用于Execution
 *
 * @author hanhan.zhang
 * */
public class StaticMemoryManager extends MemoryManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(StaticMemoryManager.class);

    public StaticMemoryManager(MetricsConf conf, long onHeapStorageMemory, long onHeapExecutionMemory) {
        super(conf, onHeapStorageMemory, onHeapExecutionMemory);

        // StaticMemoryManager不支持OFF_HEAP Storage
        offHeapExecutionMemoryPool.incrementPoolSize(offHeapStorageMemoryPool.poolSize());
        offHeapStorageMemoryPool.decrementPoolSize(offHeapStorageMemoryPool.poolSize());
    }

    @Override
    public long maxOnHeapStorageMemory() {
        return onHeapStorageMemory;
    }

    @Override
    public long maxOffHeapStorageMemory() {
        return 0L;
    }

    @Override
    public synchronized boolean acquireStorageMemory(String blockId, long numBytes, MemoryMode memoryMode) {
        if (memoryMode == MemoryMode.OFF_HEAP) {
            throw new IllegalArgumentException("StaticMemoryManager does not support off-heap storage memory");
        }
        if (numBytes > maxOnHeapStorageMemory()) {
            // Fail fast if the block simply won't fit
            LOGGER.info("Will not store {} as the required space ({} bytes) exceeds our " +
                        "memory limit ({} bytes)", blockId, numBytes, maxOnHeapStorageMemory());
            return false;
        }
        return onHeapStorageMemoryPool.acquireMemory(blockId, numBytes);
    }

    @Override
    public synchronized long acquireExecutionMemory(long numBytes, long taskAttemptId, MemoryMode memoryMode) {
        return executionPool(memoryMode).acquireMemory(numBytes, taskAttemptId);
    }
}
