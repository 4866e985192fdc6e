package com.sdu.metrics.metrics;

import com.sdu.metrics.MetricsException;

/**
 * Thrown when the capability a metric reads from is not exposed by the {@link MetricsContext}.
 *
 * @author hanhan.zhang
 * */
public class MetricUnavailableException extends MetricsException {

    private final MetricSourceType sourceType;

    public MetricUnavailableException(MetricSourceType sourceType, String message) {
        super(String.format("%s unavailable: %s", sourceType.tag(), message));
        this.sourceType = sourceType;
    }

    public MetricUnavailableException(MetricSourceType sourceType, String message, Throwable cause) {
        super(String.format("%s unavailable: %s", sourceType.tag(), message), cause);
        this.sourceType = sourceType;
    }

    public MetricSourceType sourceType() {
        return sourceType;
    }
}
