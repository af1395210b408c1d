package com.llmcat.core.tokens;

import com.knuddels.jtokkit.api.Encoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * jtokkit-backed accountant. jtokkit encodings are immutable, so counting is
 * safe from any number of threads.
 */
class JtokkitTokenAccountant implements TokenAccountant {

    private static final Logger log = LoggerFactory.getLogger(JtokkitTokenAccountant.class);

    private final String encodingName;
    private volatile Encoding encoding;

    JtokkitTokenAccountant(String encodingName, Encoding encoding) {
        this.encodingName = encodingName;
        this.encoding = encoding;
    }

    @Override
    public String encoding() {
        return encodingName;
    }

    @Override
    public int count(String text) {
        Encoding current = encoding;
        if (current == null) {
            throw new IllegalStateException("Tokenizer for " + encodingName + " has been torn down");
        }
        if (text == null || text.isEmpty()) {
            return 0;
        }
        // Special-token markers in file content are counted as plain text.
        return current.countTokensOrdinary(text);
    }

    @Override
    public synchronized void close() {
        if (encoding != null) {
            encoding = null;
            log.debug("Tore down tokenizer {}", encodingName);
        }
    }
}
