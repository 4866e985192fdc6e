package com.sdu.metrics.utils;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

/**
 * @author hanhan.zhang
 * */
public class ThreadUtils {

    private ThreadUtils() {}

    private static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder().setDaemon(daemon).setNameFormat(prefix).build();
    }

    public static ScheduledExecutorService newDaemonSingleThreadScheduledExecutor(String threadName) {
        ThreadFactory threadFactory = namedThreadFactory(threadName, true);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

}
