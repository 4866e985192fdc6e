package com.sdu.metrics.memory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link MemoryPool}职责:
 *
 * 1: 管理内存使用信息
 *
 *   1': {@link #poolSize}                      ==>> 内存池容量
 *
 *   2': {@link #memoryUsed()}                  ==>> 内存池已使用量(指标采集读取)
 *
 *   3': {@link #incrementPoolSize(long)}       ==>> 内存池扩容
 *
 *   4': {@link #decrementPoolSize(long)}       ==>> 内存池缩容
 *
 * 2: 内存池申请和释放需确保线程安全({@link #lock}确保单线程访问)
 *
 * @author hanhan.zhang
 * */
public abstract class MemoryPool {

    protected final Object lock;
    private final MemoryMode memoryMode;
    // 内存池容量
    private long poolSize;

    public MemoryPool(Object lock, MemoryMode memoryMode) {
        this.lock = lock;
        this.memoryMode = memoryMode;
    }

    public final long poolSize() {
        synchronized (lock) {
            return poolSize;
        }
    }

    public final long memoryFree() {
        synchronized (lock) {
            return poolSize - memoryUsed();
        }
    }

    public final void incrementPoolSize(long delta) {
        synchronized (lock) {
            checkArgument(delta >= 0, "memory pool increment number should greater than zero");
            poolSize += delta;
        }
    }

    public final void decrementPoolSize(long delta) {
        synchronized (lock) {
            checkArgument(delta >= 0, "memory pool decrement number should greater than zero");
            checkArgument(delta <= poolSize, "memory pool decrement number should less than pool size %s", poolSize);
            checkArgument(poolSize - delta >= memoryUsed(), "memory pool decrement number should less than free space %s", poolSize - delta);
            poolSize -= delta;
        }
    }

    protected final String poolName(String kind) {
        return memoryMode == MemoryMode.OFF_HEAP ? "off-heap " + kind : "on-heap " + kind;
    }

    public abstract long memoryUsed();
}
