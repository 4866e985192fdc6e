package com.sdu.metrics.scheduler;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.sdu.metrics.conf.MetricsConf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.sdu.metrics.conf.MetricsConf.CPU_USAGE_INITIAL_VALUE;
import static com.sdu.metrics.conf.MetricsConf.CPU_USAGE_WINDOW_SIZE;

/**
 * {@link ExecutorCpuUsageTracker}职责:
 *
 * 1: 为每个Executor保存最近{@link #windowSize}次CPU使用率采样(旧 -> 新), 计算平均使用率
 *
 * 2: 窗口初始化时全部填充{@link #initialValue}(默认100.0), Executor刚启动尚无采样时不会被当作空闲,
 *
 *    windowSize次采样后初始值全部被替换
 *
 * 3: 采样时窗口左移, 丢弃最旧采样, 最新采样写入末位
 *
 * 4: 所有操作经{@link #lock}串行化
 *
 * @author hanhan.zhang
 * */
public class ExecutorCpuUsageTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorCpuUsageTracker.class);

    public static final int DEFAULT_WINDOW_SIZE = 5;
    public static final float DEFAULT_INITIAL_VALUE = 100F;

    private final Object lock = new Object();

    private final int windowSize;
    private final float initialValue;

    // key = executorId, value = CPU使用率窗口
    private final Map<String, float[]> cpuUsages = Maps.newHashMap();

    public ExecutorCpuUsageTracker(MetricsConf conf) {
        this(conf.getInt(CPU_USAGE_WINDOW_SIZE, DEFAULT_WINDOW_SIZE),
             conf.getFloat(CPU_USAGE_INITIAL_VALUE, DEFAULT_INITIAL_VALUE));
    }

    public ExecutorCpuUsageTracker(int windowSize, float initialValue) {
        checkArgument(windowSize > 0, "cpu usage window size should be positive, but %s", windowSize);
        this.windowSize = windowSize;
        this.initialValue = initialValue;
    }

    public void init(String executorId) {
        synchronized (lock) {
            initIfAbsent(executorId);
        }
    }

    public void update(String executorId, float usage) {
        synchronized (lock) {
            float[] window = initIfAbsent(executorId);
            System.arraycopy(window, 1, window, 0, windowSize - 1);
            window[windowSize - 1] = usage;
        }
    }

    public void clear(String executorId) {
        synchronized (lock) {
            if (cpuUsages.remove(executorId) != null) {
                LOGGER.info("Cleared cpu usage of executor {}", executorId);
            }
        }
    }

    public float[] get(String executorId) {
        synchronized (lock) {
            return getOrThrow(executorId).clone();
        }
    }

    public float average(String executorId) {
        synchronized (lock) {
            float[] window = getOrThrow(executorId);
            float avgCpuUsage = 0F;
            for (float usage : window) {
                avgCpuUsage += usage;
            }
            return avgCpuUsage / window.length;
        }
    }

    public boolean contains(String executorId) {
        synchronized (lock) {
            return cpuUsages.containsKey(executorId);
        }
    }

    public ImmutableSet<String> executorIds() {
        synchronized (lock) {
            return ImmutableSet.copyOf(cpuUsages.keySet());
        }
    }

    public int windowSize() {
        return windowSize;
    }

    private float[] initIfAbsent(String executorId) {
        float[] window = cpuUsages.get(executorId);
        if (window == null) {
            window = new float[windowSize];
            Arrays.fill(window, initialValue);
            cpuUsages.put(executorId, window);
            LOGGER.debug("Initialized cpu usage window of executor {} with {}", executorId, initialValue);
        }
        return window;
    }

    private float[] getOrThrow(String executorId) {
        float[] window = cpuUsages.get(executorId);
        if (window == null) {
            throw new ExecutorNotFoundException(executorId);
        }
        return window;
    }
}
