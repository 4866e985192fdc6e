package com.sdu.metrics.metrics.cpu;

import com.sdu.metrics.conf.MetricsConf;

import java.util.Locale;

import static com.sdu.metrics.conf.MetricsConf.CPU_USAGE_JMX_HOST;
import static com.sdu.metrics.conf.MetricsConf.CPU_USAGE_JMX_PORT;
import static com.sdu.metrics.conf.MetricsConf.CPU_USAGE_SOURCE;

/**
 * @author hanhan.zhang
 * */
public class ProcessCpuSources {

    public static final String LOCAL = "local";
    public static final String JMX = "jmx";

    private ProcessCpuSources() {}

    public static ProcessCpuSource create(MetricsConf conf) {
        String source = conf.get(CPU_USAGE_SOURCE, LOCAL).trim().toLowerCase(Locale.ROOT);
        switch (source) {
            case LOCAL:
                return new LocalProcessCpuSource();
            case JMX:
                return new JmxProcessCpuSource(conf.get(CPU_USAGE_JMX_HOST, "localhost"),
                                               conf.getInt(CPU_USAGE_JMX_PORT, 9999));
            default:
                throw new IllegalArgumentException("Unsupported cpu usage source : " + source);
        }
    }
}
