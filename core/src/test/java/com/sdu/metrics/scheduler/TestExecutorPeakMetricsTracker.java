package com.sdu.metrics.scheduler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.sdu.metrics.MetricsTestUnit;
import com.sdu.metrics.metrics.ExecutorMetricType;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author hanhan.zhang
 * */
public class TestExecutorPeakMetricsTracker extends MetricsTestUnit {

    private static final int NUM_METRICS = ExecutorMetricType.numMetrics();

    private ExecutorPeakMetricsTracker tracker;

    @Override
    public void beforeEach() {
        tracker = new ExecutorPeakMetricsTracker();
    }

    private static long[] snapshot(long value) {
        long[] metrics = new long[NUM_METRICS];
        Arrays.fill(metrics, value);
        return metrics;
    }

    @Test
    public void testRegister() {
        tracker.register("1");
        long[] expected = new long[NUM_METRICS];
        expected[0] = -1L;
        assertArrayEquals(expected, tracker.peakMetrics("1"));

        // 重复注册不覆盖已有峰值
        tracker.compareAndUpdate("1", snapshot(7L));
        tracker.register("1");
        assertArrayEquals(snapshot(7L), tracker.peakMetrics("1"));
    }

    @Test
    public void testCompareAndUpdateRegistersOnFirstSight() {
        assertFalse(tracker.contains("2"));
        assertTrue(tracker.compareAndUpdate("2", snapshot(0L)));
        assertTrue(tracker.contains("2"));
        assertFalse(tracker.compareAndUpdate("2", snapshot(0L)));
        assertTrue(tracker.compareAndUpdate("2", snapshot(3L)));
        assertEquals(3L, tracker.peakMetric("2", ExecutorMetricType.CPU_TIME));
    }

    @Test
    public void testExecutorsAreIndependent() {
        tracker.compareAndUpdate("1", snapshot(10L));
        tracker.compareAndUpdate("2", snapshot(20L));
        tracker.compareAndUpdate("1", snapshot(15L));

        assertArrayEquals(snapshot(15L), tracker.peakMetrics("1"));
        assertArrayEquals(snapshot(20L), tracker.peakMetrics("2"));

        tracker.reset("2");
        assertArrayEquals(snapshot(15L), tracker.peakMetrics("1"));
        assertEquals(-1L, tracker.peakMetrics("2")[0]);

        assertTrue(tracker.remove("2"));
        assertFalse(tracker.remove("2"));
        assertEquals(ImmutableSet.of("1"), tracker.executorIds());
    }

    @Test
    public void testPeakMetricsByName() {
        long[] metrics = snapshot(1L);
        metrics[ExecutorMetricType.MAPPED_POOL_MEMORY.index()] = 512L;
        tracker.compareAndUpdate("1", metrics);

        Map<String, Long> named = tracker.peakMetricsByName("1");
        assertEquals(ExecutorMetricType.metricNames(), ImmutableList.copyOf(named.keySet()));
        assertEquals(Long.valueOf(512L), named.get("MappedPoolMemory"));
        assertEquals(Long.valueOf(1L), named.get("JVMHeapMemory"));
    }

    @Test(expected = ExecutorNotFoundException.class)
    public void testPeakMetricsOfUnknownExecutor() {
        tracker.peakMetrics("unknown");
    }

    @Test(expected = ExecutorNotFoundException.class)
    public void testResetOfRemovedExecutor() {
        tracker.register("1");
        tracker.remove("1");
        tracker.reset("1");
    }

    @Test
    public void testInvalidSnapshotDoesNotRegister() {
        try {
            tracker.compareAndUpdate("1", new long[NUM_METRICS + 1]);
        } catch (IllegalArgumentException e) {
            // expected
        }
        assertFalse(tracker.contains("1"));
    }

    @Test
    public void testConcurrentCollectorAndReporters() throws Exception {
        int rounds = 2000;
        ExecutorService threads = Executors.newFixedThreadPool(4);
        CountDownLatch started = new CountDownLatch(1);
        try {
            tracker.compareAndUpdate("1", snapshot(0L));
            Future<?> collector = threads.submit(() -> {
                started.countDown();
                for (int i = 0; i < rounds; ++i) {
                    tracker.compareAndUpdate("1", snapshot(i));
                }
            });
            started.await();
            List<Future<?>> reporters = Lists.newArrayList();
            for (int r = 0; r < 3; ++r) {
                reporters.add(threads.submit(() -> {
                    long previous = 0L;
                    for (int i = 0; i < rounds; ++i) {
                        long[] metrics = tracker.peakMetrics("1");
                        // 读取到的峰值内所有指标一致, 且峰值单调不减
                        for (long metric : metrics) {
                            assertEquals(metrics[0], metric);
                        }
                        assertTrue(metrics[0] >= previous);
                        previous = metrics[0];
                    }
                    return null;
                }));
            }
            collector.get(30, TimeUnit.SECONDS);
            for (Future<?> reporter : reporters) {
                reporter.get(30, TimeUnit.SECONDS);
            }
        } finally {
            threads.shutdownNow();
        }
        assertArrayEquals(snapshot(rounds - 1), tracker.peakMetrics("1"));
    }

    @Override
    public void afterEach() {

    }
}
