package com.sdu.metrics.metrics.cpu;

import com.sdu.metrics.metrics.MetricUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.management.MBeanServerConnection;
import javax.management.remote.JMXConnector;
import javax.management.remote.JMXConnectorFactory;
import javax.management.remote.JMXServiceURL;
import java.io.Closeable;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.RuntimeMXBean;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.function.Function;
import java.util.function.ToLongFunction;

import static com.sdu.metrics.metrics.MetricSourceType.PROCESS_CPU;

/**
 * {@link JmxProcessCpuSource}职责:
 *
 * 1: 连接远程JMX服务(service:jmx:rmi:///jndi/rmi://host:port/jmxrmi), 首次读取时建立连接
 *
 * 2: 通过MXBean代理读取远程进程CPU时间、运行时长, 连接失败或远程调用失败时抛出
 *    {@link MetricUnavailableException}, 下次读取重新连接
 *
 * @author hanhan.zhang
 * */
public class JmxProcessCpuSource implements ProcessCpuSource, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JmxProcessCpuSource.class);

    private final String host;
    private final int port;

    private JMXConnector jmxConnector;
    private com.sun.management.OperatingSystemMXBean operatingSystemMXBean;
    private RuntimeMXBean runtimeMXBean;

    public JmxProcessCpuSource(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public String serviceUrl() {
        return "service:jmx:rmi:///jndi/rmi://" + host + ":" + port + "/jmxrmi";
    }

    // 加锁返回当前代理, 保证读取期间不受并发close()影响
    private synchronized <T> T connectIfNeeded(Function<JmxProcessCpuSource, T> proxy) {
        if (jmxConnector == null) {
            try {
                JMXConnector connector = JMXConnectorFactory.connect(new JMXServiceURL(serviceUrl()), null);
                MBeanServerConnection connection = connector.getMBeanServerConnection();
                operatingSystemMXBean = ManagementFactory.newPlatformMXBeanProxy(connection,
                                                                                 ManagementFactory.OPERATING_SYSTEM_MXBEAN_NAME,
                                                                                 com.sun.management.OperatingSystemMXBean.class);
                runtimeMXBean = ManagementFactory.newPlatformMXBeanProxy(connection,
                                                                         ManagementFactory.RUNTIME_MXBEAN_NAME,
                                                                         RuntimeMXBean.class);
                jmxConnector = connector;
                LOGGER.info("Connected to JMX server {}", serviceUrl());
            } catch (IOException e) {
                throw new MetricUnavailableException(PROCESS_CPU, "failed to connect to " + serviceUrl(), e);
            }
        }
        return proxy.apply(this);
    }

    private <T> long read(Function<JmxProcessCpuSource, T> proxy, ToLongFunction<T> reader) {
        T bean = connectIfNeeded(proxy);
        try {
            return reader.applyAsLong(bean);
        } catch (UndeclaredThrowableException e) {
            // MXBean代理远程调用失败, 重置连接
            disconnect();
            throw new MetricUnavailableException(PROCESS_CPU, "remote read from " + serviceUrl() + " failed", e.getCause());
        }
    }

    @Override
    public long processCpuTime() {
        long cpuTime = read(s -> s.operatingSystemMXBean,
                            com.sun.management.OperatingSystemMXBean::getProcessCpuTime);
        if (cpuTime < 0) {
            throw new MetricUnavailableException(PROCESS_CPU, "process cpu time not supported by " + serviceUrl());
        }
        return cpuTime;
    }

    @Override
    public long uptime() {
        return read(s -> s.runtimeMXBean, RuntimeMXBean::getUptime);
    }

    @Override
    public int availableProcessors() {
        return (int) read(s -> s.operatingSystemMXBean,
                          com.sun.management.OperatingSystemMXBean::getAvailableProcessors);
    }

    private synchronized void disconnect() {
        if (jmxConnector == null) {
            return;
        }
        try {
            jmxConnector.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close JMX connection {}", serviceUrl(), e);
        } finally {
            jmxConnector = null;
            operatingSystemMXBean = null;
            runtimeMXBean = null;
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    @Override
    public String toString() {
        return "JmxProcessCpuSource(" + serviceUrl() + ")";
    }
}
