package com.sdu.metrics.conf;

import com.sdu.metrics.MetricsTestUnit;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * @author hanhan.zhang
 * */
public class TestMetricsConf extends MetricsTestUnit {

    private MetricsConf metricsConf;

    @Override
    public void beforeEach() {
        metricsConf = conf.copy();
    }

    @Test
    public void testTypedGetters() {
        assertEquals(5, metricsConf.getInt(MetricsConf.CPU_USAGE_WINDOW_SIZE, 1));
        assertEquals(100F, metricsConf.getFloat(MetricsConf.CPU_USAGE_INITIAL_VALUE, 0F), 0F);
        assertEquals(0.5, metricsConf.getDouble("spark.memory.storageFraction", 0.0), 0.0);
        // 缺省值
        assertEquals(7L, metricsConf.getLong("spark.missing", 7L));
        assertEquals(3, metricsConf.getInt("spark.missing", 3));
        // 非法数值回退缺省值
        metricsConf.set("spark.bad.number", "abc");
        assertEquals(3, metricsConf.getInt("spark.bad.number", 3));
    }

    @Test
    public void testBoolean() {
        assertTrue(metricsConf.getBoolean(MetricsConf.METRICS_CLEAR_ON_STOP, false));
        assertFalse(metricsConf.getBoolean("spark.memory.offHeap.enabled", true));
        assertTrue(metricsConf.getBoolean("spark.missing", true));
    }

    @Test
    public void testTimeAndSize() {
        assertEquals(10000L, metricsConf.getTimeAsMs(MetricsConf.METRICS_POLLING_INTERVAL, "1s"));
        assertEquals(500L, metricsConf.getTimeAsMs("spark.missing", "500ms"));
        assertEquals(120000L, metricsConf.getTimeAsMs("spark.missing", "2min"));
        assertEquals(10240L, metricsConf.getSizeAsBytes("spark.memory.offHeap.size", "0"));
        assertEquals(3L << 30, metricsConf.getSizeAsBytes("spark.missing", "3g"));
        assertEquals(42L, metricsConf.getSizeAsBytes("spark.missing", "42"));
    }

    @Test(expected = NumberFormatException.class)
    public void testInvalidTimeSuffix() {
        metricsConf.set(MetricsConf.METRICS_POLLING_INTERVAL, "10 parsecs");
        metricsConf.getTimeAsMs(MetricsConf.METRICS_POLLING_INTERVAL, "10s");
    }

    @Test(expected = NumberFormatException.class)
    public void testInvalidSizeSuffix() {
        metricsConf.getSizeAsBytes("spark.missing", "10x");
    }

    @Test
    public void testCopyIsIndependent() {
        MetricsConf copied = metricsConf.copy();
        copied.set(MetricsConf.CPU_USAGE_WINDOW_SIZE, "8");
        assertEquals(5, metricsConf.getInt(MetricsConf.CPU_USAGE_WINDOW_SIZE, 1));
        assertEquals(8, copied.getInt(MetricsConf.CPU_USAGE_WINDOW_SIZE, 1));

        copied.setIfMissing(MetricsConf.CPU_USAGE_WINDOW_SIZE, "9");
        assertEquals(8, copied.getInt(MetricsConf.CPU_USAGE_WINDOW_SIZE, 1));
    }

    @Override
    public void afterEach() {

    }
}
