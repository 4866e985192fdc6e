package com.sdu.metrics.metrics.cpu;

import com.sdu.metrics.metrics.MetricUnavailableException;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;

import static com.sdu.metrics.metrics.MetricSourceType.PROCESS_CPU;

/**
 * @author hanhan.zhang
 * */
public class LocalProcessCpuSource implements ProcessCpuSource {

    private final OperatingSystemMXBean operatingSystemMXBean;
    private final RuntimeMXBean runtimeMXBean;

    public LocalProcessCpuSource() {
        this(ManagementFactory.getOperatingSystemMXBean(), ManagementFactory.getRuntimeMXBean());
    }

    LocalProcessCpuSource(OperatingSystemMXBean operatingSystemMXBean, RuntimeMXBean runtimeMXBean) {
        this.operatingSystemMXBean = operatingSystemMXBean;
        this.runtimeMXBean = runtimeMXBean;
    }

    @Override
    public long processCpuTime() {
        if (!(operatingSystemMXBean instanceof com.sun.management.OperatingSystemMXBean)) {
            throw new MetricUnavailableException(PROCESS_CPU, "platform does not expose process cpu time");
        }
        long cpuTime = ((com.sun.management.OperatingSystemMXBean) operatingSystemMXBean).getProcessCpuTime();
        if (cpuTime < 0) {
            throw new MetricUnavailableException(PROCESS_CPU, "process cpu time not supported");
        }
        return cpuTime;
    }

    @Override
    public long uptime() {
        return runtimeMXBean.getUptime();
    }

    @Override
    public int availableProcessors() {
        return operatingSystemMXBean.getAvailableProcessors();
    }

    @Override
    public String toString() {
        return "LocalProcessCpuSource";
    }
}
