package com.sdu.metrics.scheduler;

import com.sdu.metrics.MetricsException;

/**
 * @author hanhan.zhang
 * */
public class ExecutorNotFoundException extends MetricsException {

    private final String executorId;

    public ExecutorNotFoundException(String executorId) {
        super(String.format("Executor %s not tracked", executorId));
        this.executorId = executorId;
    }

    public String executorId() {
        return executorId;
    }
}
