package com.sdu.metrics.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Block存储内存池, 可用内存不足时申请失败(不做Block逐出)
 *
 * @author hanhan.zhang
 * */
public class StorageMemoryPool extends MemoryPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(StorageMemoryPool.class);

    private final String poolName;

    // 标识当前存储内存池已使用量
    private long memoryUsed = 0L;

    public StorageMemoryPool(Object lock, MemoryMode memoryMode) {
        super(lock, memoryMode);
        this.poolName = poolName("storage");
    }

    @Override
    public long memoryUsed() {
        synchronized (lock) {
            return memoryUsed;
        }
    }

    public boolean acquireMemory(String blockId, long numBytes) {
        synchronized (lock) {
            checkArgument(numBytes >= 0, "invalid number of bytes requested: %s", numBytes);
            boolean enoughMemory = numBytes <= memoryFree();
            if (enoughMemory) {
                memoryUsed += numBytes;
            } else {
                LOGGER.info("Will not store {} as the required space ({} bytes) exceeds free {} memory ({} bytes)",
                            blockId, numBytes, poolName, memoryFree());
            }
            return enoughMemory;
        }
    }

    public void releaseMemory(long size) {
        synchronized (lock) {
            if (size > memoryUsed) {
                LOGGER.warn("Attempted to release {} bytes of storage memory when we only have {} bytes", size, memoryUsed);
                memoryUsed = 0;
            } else {
                memoryUsed -= size;
            }
        }
    }

    public void releaseAllMemory() {
        synchronized (lock) {
            memoryUsed = 0;
        }
    }
}
