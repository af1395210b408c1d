package com.llmcat.core.dispatch;

/**
 * Processes one claimed task. Implementations must contain their own failures;
 * anything thrown is treated as a bug in the handler.
 */
@FunctionalInterface
public interface TaskHandler<T> {
    void handle(int index, T task);
}
