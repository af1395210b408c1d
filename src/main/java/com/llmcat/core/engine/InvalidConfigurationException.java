package com.llmcat.core.engine;

/**
 * Thrown when run settings are unusable, e.g. a thread count below 1.
 */
public class InvalidConfigurationException extends AggregationException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
