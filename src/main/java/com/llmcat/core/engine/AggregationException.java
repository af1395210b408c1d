package com.llmcat.core.engine;

/**
 * Fatal failure of a whole aggregation run. Raised before any task is dispatched;
 * per-task problems never surface as this exception.
 */
public class AggregationException extends RuntimeException {
    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
