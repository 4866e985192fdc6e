package com.sdu.metrics.metrics;

import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;

/**
 * @author hanhan.zhang
 * */
public class FakeMemoryMXBean implements MemoryMXBean {

    public volatile long heapUsed;
    public volatile long nonHeapUsed;

    public FakeMemoryMXBean(long heapUsed, long nonHeapUsed) {
        this.heapUsed = heapUsed;
        this.nonHeapUsed = nonHeapUsed;
    }

    @Override
    public int getObjectPendingFinalizationCount() {
        return 0;
    }

    @Override
    public MemoryUsage getHeapMemoryUsage() {
        return new MemoryUsage(0, heapUsed, heapUsed, -1);
    }

    @Override
    public MemoryUsage getNonHeapMemoryUsage() {
        return new MemoryUsage(0, nonHeapUsed, nonHeapUsed, -1);
    }

    @Override
    public boolean isVerbose() {
        return false;
    }

    @Override
    public void setVerbose(boolean value) {}

    @Override
    public void gc() {}

    @Override
    public ObjectName getObjectName() {
        try {
            return new ObjectName(ManagementFactory.MEMORY_MXBEAN_NAME);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
