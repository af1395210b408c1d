package com.llmcat.core.tokens;

import com.llmcat.core.engine.AggregationException;

/**
 * Thrown when the tokenizer cannot be set up for the requested encoding.
 * There is no fallback encoding, so the whole run stops.
 */
public class TokenizerInitException extends AggregationException {

    private final String encoding;

    public TokenizerInitException(String encoding, String message) {
        super(message);
        this.encoding = encoding;
    }

    public TokenizerInitException(String encoding, String message, Throwable cause) {
        super(message, cause);
        this.encoding = encoding;
    }

    public String getEncoding() {
        return encoding;
    }
}
