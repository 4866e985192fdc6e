package com.sdu.metrics.metrics.cpu;

import com.sdu.metrics.conf.MetricsConf;
import com.sdu.metrics.metrics.MetricUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.sdu.metrics.conf.MetricsConf.CPU_USAGE_SCALE_FACTOR;

/**
 * 计算两次采样间进程CPU使用率(百分比):
 *
 *  cpuUsage = elapsedCpuTime(ns) / (elapsedUptime(ms) * availableProcessors * scaleFactor)
 *
 * scaleFactor默认10000: ns转ms除以1000000, 转百分比乘以100. 每次计算后以当前读数作为下次基线.
 *
 * 非线程安全, 由采集线程独占.
 *
 * @author hanhan.zhang
 * */
public class CpuUsageCalculator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CpuUsageCalculator.class);

    public static final float DEFAULT_SCALE_FACTOR = 10000F;

    private final ProcessCpuSource source;
    private final float scaleFactor;

    // 上次采样读数
    private long prevProcessCpuTime = 0;
    private long prevUptime = 0;

    public CpuUsageCalculator(ProcessCpuSource source, MetricsConf conf) {
        this(source, conf.getFloat(CPU_USAGE_SCALE_FACTOR, DEFAULT_SCALE_FACTOR));
    }

    public CpuUsageCalculator(ProcessCpuSource source, float scaleFactor) {
        checkArgument(scaleFactor > 0, "cpu usage scale factor should be positive, but %s", scaleFactor);
        this.source = checkNotNull(source);
        this.scaleFactor = scaleFactor;
    }

    /**
     * Record the current readings as the baseline of the next {@link #cpuUsage()}.
     * */
    public void start() throws MetricUnavailableException {
        prevProcessCpuTime = source.processCpuTime();
        prevUptime = source.uptime();
        LOGGER.debug("Start calculating cpu usage: prevCpuTime={}ns, prevUpTime={}ms", prevProcessCpuTime, prevUptime);
    }

    public float cpuUsage() throws MetricUnavailableException {
        long curProcessCpuTime = source.processCpuTime();
        long curUptime = source.uptime();
        int processorNum = source.availableProcessors();

        // elapsed process time is in nanoseconds
        long elapsedProcessCpuTime = curProcessCpuTime - prevProcessCpuTime;
        // elapsed uptime is in milliseconds
        long elapsedUptime = curUptime - prevUptime;

        prevProcessCpuTime = curProcessCpuTime;
        prevUptime = curUptime;

        // total jvm uptime on all the available processors
        long totalElapsedUptime = elapsedUptime * processorNum;
        if (totalElapsedUptime <= 0) {
            return 0F;
        }

        float cpuUsage = elapsedProcessCpuTime / (totalElapsedUptime * scaleFactor);
        LOGGER.debug("elapsedCpuTime={}ns, elapsedUpTime={}ms, processorNum={}, cpuUsage={}",
                     elapsedProcessCpuTime, elapsedUptime, processorNum, cpuUsage);
        return cpuUsage;
    }

    public float scaleFactor() {
        return scaleFactor;
    }
}
