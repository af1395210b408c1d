package com.llmcat.core.dispatch;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pre-enumerated task list with an atomic claim cursor.
 * <p>
 * Every call to {@link #claim()} performs one fetch-and-increment on the cursor, so
 * each index in {@code [0, size)} is handed out exactly once no matter how many
 * threads pull concurrently. Claiming never blocks and tasks are never requeued.
 *
 * @param <T> task type
 */
public final class TaskQueue<T> {

    private final List<T> tasks;
    private final AtomicInteger cursor = new AtomicInteger();

    public TaskQueue(List<T> tasks) {
        this.tasks = List.copyOf(tasks);
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Claims the next task.
     *
     * @return the claimed task with its index, or {@code null} once the queue is drained
     */
    public Claim<T> claim() {
        int index = cursor.getAndIncrement();
        if (index < 0 || index >= tasks.size()) {
            return null;
        }
        return new Claim<>(index, tasks.get(index));
    }

    /** A task handed to exactly one worker. */
    public record Claim<T>(int index, T task) {}
}
