package com.sdu.metrics.memory;

import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link ExecutionMemoryPool}职责:
 *
 * 1: {@link #memoryForTask}记录每个Task分配的Execution内存量
 *
 * 2: 对应当前N个Task, 每个Task最多分配 1/N * poolSize 内存
 *
 * @author hanhan.zhang
 * */
public class ExecutionMemoryPool extends MemoryPool {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionMemoryPool.class);

    private final String poolName;

    // Task内存分配信息 ==> key = taskId, value = 分配内存数
    private final Map<Long, Long> memoryForTask = Maps.newHashMap();

    public ExecutionMemoryPool(Object lock, MemoryMode memoryMode) {
        super(lock, memoryMode);
        this.poolName = poolName("execution");
    }

    @Override
    public long memoryUsed() {
        synchronized (lock) {
            long sum = 0;
            for (long used : memoryForTask.values()) {
                sum += used;
            }
            return sum;
        }
    }

    public long getMemoryUsageForTask(long taskAttemptId) {
        synchronized (lock) {
            return memoryForTask.getOrDefault(taskAttemptId, 0L);
        }
    }

    /**
     * Try to acquire up to `numBytes` of memory for the given task and return the number of bytes
     * obtained, or 0 if none can be allocated.
     * */
    public long acquireMemory(long numBytes, long taskAttemptId) {
        synchronized (lock) {
            checkArgument(numBytes > 0, "invalid number of bytes requested: %s", numBytes);

            // Add this task to the taskMemory map just so we can keep an accurate count of the number
            // of active tasks
            memoryForTask.putIfAbsent(taskAttemptId, 0L);

            long numActiveTasks = memoryForTask.size();
            long curMem = memoryForTask.get(taskAttemptId);
            long maxMemoryPerTask = poolSize() / numActiveTasks;

            // 若是Task已分配maxMemoryPerTask, 则需要分配内存容量0
            long maxToGrant = Math.min(numBytes, Math.max(0, maxMemoryPerTask - curMem));
            long toGrant = Math.min(maxToGrant, memoryFree());
            if (toGrant < numBytes) {
                LOGGER.debug("TID {} requested {} bytes from {} pool, granted {}", taskAttemptId, numBytes, poolName, toGrant);
            }
            memoryForTask.put(taskAttemptId, curMem + toGrant);
            return toGrant;
        }
    }

    public void releaseMemory(long numBytes, long taskAttemptId) {
        synchronized (lock) {
            long curMem = memoryForTask.getOrDefault(taskAttemptId, 0L);
            long memoryToFree;
            if (curMem < numBytes) {
                LOGGER.warn("Internal error: release called on {} bytes but task only has {} bytes of memory from the {} pool",
                                numBytes, curMem, poolName);
                memoryToFree = curMem;
            } else {
                memoryToFree = numBytes;
            }
            if (memoryForTask.containsKey(taskAttemptId)) {
                long remainGrant = curMem - memoryToFree;
                if (remainGrant <= 0) {
                    memoryForTask.remove(taskAttemptId);
                } else {
                    memoryForTask.put(taskAttemptId, remainGrant);
                }
            }
        }
    }

    public long releaseAllMemoryForTask(long taskAttemptId) {
        synchronized (lock) {
            long numBytesToFree = getMemoryUsageForTask(taskAttemptId);
            releaseMemory(numBytesToFree, taskAttemptId);
            return numBytesToFree;
        }
    }
}
