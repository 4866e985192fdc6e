package com.sdu.metrics.metrics;

/**
 * @author hanhan.zhang
 * */
@FunctionalInterface
public interface MetricGetter {

    long getMetricValue(MetricsContext context) throws MetricUnavailableException;

}
