package com.sdu.metrics.memory;

import com.sdu.metrics.MetricsTestUnit;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author hanhan.zhang
 * */
public class TestMemoryManager extends MetricsTestUnit {

    private MemoryManager memoryManager;

    @Override
    public void beforeEach() {
        memoryManager = new StaticMemoryManager(conf, 1000L, 1000L);
    }

    @Test
    public void testAcquireExecutionMemory() {
        // 申请内存
        assertEquals(100L, memoryManager.acquireExecutionMemory(100L, 0, MemoryMode.ON_HEAP));
        assertEquals(400L, memoryManager.acquireExecutionMemory(400L, 0, MemoryMode.ON_HEAP));
        assertEquals(400L, memoryManager.acquireExecutionMemory(400L, 0, MemoryMode.ON_HEAP));
        // 仅剩100
        assertEquals(100L, memoryManager.acquireExecutionMemory(200L, 0, MemoryMode.ON_HEAP));
        assertEquals(0L, memoryManager.acquireExecutionMemory(100L, 0, MemoryMode.ON_HEAP));
        assertEquals(1000L, memoryManager.onHeapExecutionMemoryUsed());

        // 释放内存
        assertEquals(1000L, memoryManager.releaseAllExecutionMemoryForTask(0));
        assertEquals(0L, memoryManager.onHeapExecutionMemoryUsed());

        // 申请内存
        assertEquals(1000L, memoryManager.acquireExecutionMemory(1000L, 0, MemoryMode.ON_HEAP));
    }

    @Test
    public void testExecutionMemoryPerTask() {
        assertEquals(1000L, memoryManager.acquireExecutionMemory(1000L, 1, MemoryMode.ON_HEAP));
        // 新Task最多分配1/N, 但已无可用内存
        assertEquals(0L, memoryManager.acquireExecutionMemory(100L, 2, MemoryMode.ON_HEAP));
        memoryManager.releaseExecutionMemory(600L, 1, MemoryMode.ON_HEAP);
        assertEquals(400L, memoryManager.getExecutionMemoryUsageForTask(1));
        // 两个Task, 每个Task最多500
        assertEquals(500L, memoryManager.acquireExecutionMemory(600L, 2, MemoryMode.ON_HEAP));
        assertEquals(900L, memoryManager.executionMemoryUsed());
    }

    @Test
    public void testOffHeapExecutionMemory() {
        // StaticMemoryManager非堆内存全部用于Execution: 10k
        assertEquals(10240L, memoryManager.acquireExecutionMemory(20480L, 3, MemoryMode.OFF_HEAP));
        assertEquals(10240L, memoryManager.offHeapExecutionMemoryUsed());
        assertEquals(0L, memoryManager.onHeapExecutionMemoryUsed());
    }

    @Test
    public void testAcquireStorageMemory() {
        assertTrue(memoryManager.acquireStorageMemory("rdd_0_0", 600L, MemoryMode.ON_HEAP));
        assertFalse(memoryManager.acquireStorageMemory("rdd_0_1", 600L, MemoryMode.ON_HEAP));
        assertFalse(memoryManager.acquireStorageMemory("rdd_0_2", 2000L, MemoryMode.ON_HEAP));
        assertEquals(600L, memoryManager.onHeapStorageMemoryUsed());
        assertEquals(0L, memoryManager.offHeapStorageMemoryUsed());

        memoryManager.releaseStorageMemory(200L, MemoryMode.ON_HEAP);
        assertEquals(400L, memoryManager.storageMemoryUsed());
        memoryManager.releaseAllStorageMemory();
        assertEquals(0L, memoryManager.storageMemoryUsed());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOffHeapStorageNotSupported() {
        memoryManager.acquireStorageMemory("rdd_0_0", 1L, MemoryMode.OFF_HEAP);
    }

    @Override
    public void afterEach() {

    }
}
