package com.llmcat.core.engine;

/**
 * Thrown when a run is requested without a single target.
 */
public class NoTargetsException extends AggregationException {
    public NoTargetsException() {
        super("No targets given");
    }
}
