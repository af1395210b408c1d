package com.llmcat.core.tokens;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class JtokkitTokenAccountantProviderTest {

    private final JtokkitTokenAccountantProvider provider = new JtokkitTokenAccountantProvider();

    @ParameterizedTest
    @ValueSource(strings = {"cl100k_base", "o200k_base", "p50k_base", "p50k_edit", "r50k_base"})
    @DisplayName("every supported encoding initializes")
    void supportedEncodings(String encoding) {
        try (TokenAccountant tokens = provider.open(encoding)) {
            assertEquals(encoding, tokens.encoding());
            assertTrue(tokens.count("hello world") > 0);
        }
    }

    @Test
    @DisplayName("cl100k_base counts a known greeting exactly")
    void knownCount() {
        try (TokenAccountant tokens = provider.open("cl100k_base")) {
            // "Hello, world!" is 4 tokens in cl100k_base
            assertEquals(4, tokens.count("Hello, world!"));
        }
    }

    @Test
    @DisplayName("empty text counts as zero")
    void emptyText() {
        try (TokenAccountant tokens = provider.open("cl100k_base")) {
            assertEquals(0, tokens.count(""));
        }
    }

    @Test
    @DisplayName("special-token markers in content are counted as text instead of failing")
    void specialTokensAsText() {
        try (TokenAccountant tokens = provider.open("cl100k_base")) {
            assertTrue(tokens.count("before <|endoftext|> after") > 3);
        }
    }

    @Test
    @DisplayName("unknown encoding is a fatal initialization error")
    void unknownEncoding() {
        var e = assertThrows(TokenizerInitException.class, () -> provider.open("gpt-17"));
        assertEquals("gpt-17", e.getEncoding());
        assertTrue(e.getMessage().contains("cl100k_base"));
    }

    @Test
    @DisplayName("null encoding is rejected")
    void nullEncoding() {
        assertThrows(TokenizerInitException.class, () -> provider.open(null));
    }

    @Test
    @DisplayName("counting after teardown fails; repeated teardown is harmless")
    void teardown() {
        TokenAccountant tokens = provider.open("cl100k_base");
        tokens.close();
        tokens.close();
        assertThrows(IllegalStateException.class, () -> tokens.count("x"));
    }
}
