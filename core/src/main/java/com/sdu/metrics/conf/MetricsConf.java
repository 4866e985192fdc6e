package com.sdu.metrics.conf;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.Serializable;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.sdu.metrics.utils.Utils.byteStringAsBytes;
import static com.sdu.metrics.utils.Utils.timeStringAs;

/**
 * Executor指标采集配置, 所有配置项以字符串保存, 读取时按类型转换
 *
 * @author hanhan.zhang
 * */
public class MetricsConf implements Serializable {

    /** 指标采集周期 */
    public static final String METRICS_POLLING_INTERVAL = "spark.executor.metrics.pollingInterval";
    /** Executor停止采集时是否清除其峰值及CPU窗口 */
    public static final String METRICS_CLEAR_ON_STOP = "spark.executor.metrics.clearOnStop";

    public static final String CPU_USAGE_WINDOW_SIZE = "spark.executor.cpuUsage.windowSize";
    public static final String CPU_USAGE_INITIAL_VALUE = "spark.executor.cpuUsage.initialValue";
    public static final String CPU_USAGE_SCALE_FACTOR = "spark.executor.cpuUsage.scaleFactor";
    public static final String CPU_USAGE_SOURCE = "spark.executor.cpuUsage.source";
    public static final String CPU_USAGE_JMX_HOST = "spark.executor.cpuUsage.jmx.host";
    public static final String CPU_USAGE_JMX_PORT = "spark.executor.cpuUsage.jmx.port";

    private Map<String, String> settings = Maps.newConcurrentMap();

    public MetricsConf set(String key, String value) {
        settings.put(key, value);
        return this;
    }

    public MetricsConf setIfMissing(String key, String value) {
        settings.putIfAbsent(key, value);
        return this;
    }

    public MetricsConf remove(String key) {
        settings.remove(key);
        return this;
    }

    public String get(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }

    public String get(String key) {
        return settings.get(key);
    }

    public boolean contains(String key) {
        return settings.containsKey(key);
    }

    public long getLong(String key, long defaultValue) {
        String value = settings.get(key);
        return NumberUtils.toLong(value, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = settings.get(key);
        return NumberUtils.toInt(value, defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        String value = settings.get(key);
        return NumberUtils.toDouble(value, defaultValue);
    }

    public float getFloat(String key, float defaultValue) {
        String value = settings.get(key);
        return NumberUtils.toFloat(value, defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = settings.get(key);
        if (Strings.isNullOrEmpty(value)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    public long getTimeAsMs(String key, String defaultValue) {
        return timeStringAs(get(key, defaultValue), TimeUnit.MILLISECONDS);
    }

    public long getSizeAsBytes(String key, String defaultValue) {
        return byteStringAsBytes(get(key, defaultValue));
    }

    public MetricsConf copy() {
        MetricsConf other = new MetricsConf();
        other.settings.putAll(settings);
        return other;
    }
}
