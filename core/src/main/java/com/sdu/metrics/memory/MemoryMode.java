package com.sdu.metrics.memory;

/**
 * @author hanhan.zhang
 * */
public enum MemoryMode {
    ON_HEAP, OFF_HEAP
}
