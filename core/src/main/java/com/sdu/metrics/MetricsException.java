package com.sdu.metrics;

/**
 * @author hanhan.zhang
 * */
public class MetricsException extends RuntimeException {

    public MetricsException(String message) {
        super(message);
    }

    public MetricsException(Throwable cause) {
        super(cause);
    }

    public MetricsException(String message, Throwable cause) {
        super(message, cause);
    }
}
