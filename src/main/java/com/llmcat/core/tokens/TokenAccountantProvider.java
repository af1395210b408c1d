package com.llmcat.core.tokens;

/**
 * Creates {@link TokenAccountant}s; the encoding-scoped resource is acquired here.
 */
@FunctionalInterface
public interface TokenAccountantProvider {

    /**
     * Initializes a tokenizer for the given encoding.
     *
     * @param encoding opaque encoding name, e.g. {@code cl100k_base}
     * @throws TokenizerInitException if the encoding is unknown or cannot be loaded
     */
    TokenAccountant open(String encoding);
}
