package com.llmcat.core.aggregate;

import com.llmcat.core.model.AggregationResult;
import com.llmcat.core.model.Fragment;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The shared document buffer and token total.
 * <p>
 * Both are mutated only while holding one lock, and only for the in-memory
 * append. Workers build their {@link Fragment}s privately and call
 * {@link #merge(Fragment)} once per task.
 */
public class ResultAggregator {

    private final ReentrantLock lock = new ReentrantLock();
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private long tokenTotal;
    private int merged;
    private int failed;

    /**
     * @param structure the rendered structure section, written before any fragment
     */
    public ResultAggregator(String structure) {
        buffer.writeBytes(structure.getBytes(StandardCharsets.UTF_8));
    }

    public void merge(Fragment fragment) {
        lock.lock();
        try {
            buffer.writeBytes(fragment.bytes());
            tokenTotal += fragment.tokenCount();
            merged++;
            if (!fragment.succeeded()) {
                failed++;
            }
        } finally {
            lock.unlock();
        }
    }

    long tokenTotal() {
        lock.lock();
        try {
            return tokenTotal;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the buffer and counters. Call after all workers have finished.
     *
     * @param workers worker threads the run spawned
     */
    public AggregationResult result(int workers) {
        lock.lock();
        try {
            return new AggregationResult(buffer.toByteArray(), tokenTotal, merged, failed, workers);
        } finally {
            lock.unlock();
        }
    }
}
