package com.llmcat.handoff;

/**
 * Thrown when a sink cannot deliver the document. The document itself is unaffected.
 */
public class SinkException extends Exception {
    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
