package com.sdu.metrics.utils;

/**
 * @author hanhan.zhang
 * */
public interface Clock {

    long getTimeMillis();

    class SystemClock implements Clock {

        @Override
        public long getTimeMillis() {
            return System.currentTimeMillis();
        }

    }
}
