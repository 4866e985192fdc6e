package com.sdu.metrics.executor;

import com.sdu.metrics.conf.MetricsConf;
import com.sdu.metrics.metrics.ExecutorMetricType;
import com.sdu.metrics.metrics.MetricUnavailableException;
import com.sdu.metrics.metrics.MetricsContext;
import com.sdu.metrics.metrics.cpu.CpuUsageCalculator;
import com.sdu.metrics.scheduler.ExecutorCpuUsageTracker;
import com.sdu.metrics.scheduler.ExecutorPeakMetricsTracker;
import com.sdu.metrics.utils.Clock;
import com.sdu.metrics.utils.Clock.SystemClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.sdu.metrics.conf.MetricsConf.METRICS_CLEAR_ON_STOP;
import static com.sdu.metrics.conf.MetricsConf.METRICS_POLLING_INTERVAL;
import static com.sdu.metrics.utils.ThreadUtils.newDaemonSingleThreadScheduledExecutor;

/**
 * {@link ExecutorMetricsPoller}职责:
 *
 * 1: 周期采集Executor指标(采集周期spark.executor.metrics.pollingInterval, 默认10s), 每次采集流程:
 *
 *   ExecutorMetricsPoller.poll()
 *      |
 *      +-----> ExecutorMetricType.getCurrentMetrics()【指标快照, 不可用指标记为0】
 *      |           |
 *      |           +-----> ExecutorPeakMetricsTracker.compareAndUpdate()【更新峰值】
 *      |
 *      +-----> CpuUsageCalculator.cpuUsage()【两次采集间CPU使用率】
 *                  |
 *                  +-----> ExecutorCpuUsageTracker.update()【更新CPU使用率窗口】
 *
 * 2: 同一Executor的采集由单线程按序执行, 保证快照按采集顺序生效
 *
 * 3: {@link #report()}汇总峰值及平均CPU使用率
 *
 * @author hanhan.zhang
 * */
public class ExecutorMetricsPoller {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorMetricsPoller.class);

    private final String executorId;
    private final MetricsConf conf;
    private final MetricsContext context;
    private final ExecutorPeakMetricsTracker peakTracker;
    private final ExecutorCpuUsageTracker cpuTracker;
    private final Clock clock;

    // 进程CPU不可用时为空, 仅采集内存指标
    private final CpuUsageCalculator cpuCalculator;

    private ScheduledExecutorService poller;
    private volatile long lastPollTime = -1L;

    public ExecutorMetricsPoller(String executorId,
                                 MetricsConf conf,
                                 MetricsContext context,
                                 ExecutorPeakMetricsTracker peakTracker,
                                 ExecutorCpuUsageTracker cpuTracker) {
        this(executorId, conf, context, peakTracker, cpuTracker, new SystemClock());
    }

    public ExecutorMetricsPoller(String executorId,
                                 MetricsConf conf,
                                 MetricsContext context,
                                 ExecutorPeakMetricsTracker peakTracker,
                                 ExecutorCpuUsageTracker cpuTracker,
                                 Clock clock) {
        this.executorId = executorId;
        this.conf = conf;
        this.context = context;
        this.peakTracker = peakTracker;
        this.cpuTracker = cpuTracker;
        this.clock = clock;
        this.cpuCalculator = createCpuCalculator();

        peakTracker.register(executorId);
        cpuTracker.init(executorId);
    }

    private CpuUsageCalculator createCpuCalculator() {
        try {
            return new CpuUsageCalculator(context.processCpu(), conf);
        } catch (MetricUnavailableException e) {
            LOGGER.info("Cpu usage of executor {} will not be collected: {}", executorId, e.getMessage());
            return null;
        }
    }

    public synchronized void start() {
        checkState(poller == null, "metrics poller of executor %s already started", executorId);
        long intervalMs = conf.getTimeAsMs(METRICS_POLLING_INTERVAL, "10s");
        checkArgument(intervalMs > 0, "%s should be positive, but %s", METRICS_POLLING_INTERVAL, intervalMs);

        if (cpuCalculator != null) {
            try {
                cpuCalculator.start();
            } catch (MetricUnavailableException e) {
                LOGGER.debug("Failed to record cpu baseline of executor {}", executorId, e);
            }
        }

        poller = newDaemonSingleThreadScheduledExecutor("executor-metrics-poller-" + executorId);
        poller.scheduleAtFixedRate(this::pollSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOGGER.info("Started metrics poller of executor {} with interval {}ms", executorId, intervalMs);
    }

    private void pollSafely() {
        try {
            poll();
        } catch (Exception e) {
            // 异常逃逸会终止周期调度
            LOGGER.warn("Failed to poll metrics of executor {}", executorId, e);
        }
    }

    /**
     * Collect one snapshot and feed it to the peak and cpu usage trackers.
     * */
    public void poll() {
        long[] snapshot = ExecutorMetricType.getCurrentMetrics(context);
        if (peakTracker.compareAndUpdate(executorId, snapshot)) {
            LOGGER.debug("New peak metrics of executor {}", executorId);
        }

        if (cpuCalculator != null) {
            try {
                cpuTracker.update(executorId, cpuCalculator.cpuUsage());
            } catch (MetricUnavailableException e) {
                LOGGER.debug("Skip cpu usage sample of executor {}: {}", executorId, e.getMessage());
            }
        }
        lastPollTime = clock.getTimeMillis();
    }

    public ExecutorMetricsSummary report() {
        return new ExecutorMetricsSummary(executorId,
                                          peakTracker.peakMetricsByName(executorId),
                                          cpuTracker.average(executorId),
                                          cpuTracker.get(executorId),
                                          lastPollTime);
    }

    public synchronized void stop() {
        if (poller != null) {
            poller.shutdownNow();
            try {
                if (!poller.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOGGER.warn("Metrics poller of executor {} did not terminate in time", executorId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            poller = null;
        }

        if (conf.getBoolean(METRICS_CLEAR_ON_STOP, true)) {
            peakTracker.remove(executorId);
            cpuTracker.clear(executorId);
        }
        LOGGER.info("Stopped metrics poller of executor {}", executorId);
    }

    public boolean isCpuUsageCollected() {
        return cpuCalculator != null;
    }
}
