package com.llmcat.core.tokens;

/**
 * An initialized tokenizer for one encoding.
 * <p>
 * Obtained from {@link TokenAccountantProvider#open(String)} and released with
 * {@link #close()}, which tears the tokenizer down exactly once. {@link #count(String)}
 * may be called from many worker threads at the same time.
 */
public interface TokenAccountant extends AutoCloseable {

    /** Name of the encoding this accountant was initialized with. */
    String encoding();

    /**
     * Counts the tokens of {@code text}.
     *
     * @return a non-negative token count
     * @throws IllegalStateException if called after {@link #close()}
     */
    int count(String text);

    /** Tears the tokenizer down. Further calls are no-ops. */
    @Override
    void close();
}
