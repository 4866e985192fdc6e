package com.sdu.metrics.metrics.cpu;

import com.sdu.metrics.metrics.MetricUnavailableException;

/**
 * 进程CPU读数来源, 有两种实现:
 *
 *  1': {@link LocalProcessCpuSource}   ==> 本进程Platform MXBean
 *
 *  2': {@link JmxProcessCpuSource}     ==> 远程JMX连接上的MXBean代理
 *
 * 由配置项spark.executor.cpuUsage.source选择, 见{@link ProcessCpuSources#create}
 *
 * @author hanhan.zhang
 * */
public interface ProcessCpuSource {

    /** CPU time used by the process, in nanoseconds. */
    long processCpuTime() throws MetricUnavailableException;

    /** Uptime of the JVM, in milliseconds. */
    long uptime() throws MetricUnavailableException;

    int availableProcessors() throws MetricUnavailableException;

}
