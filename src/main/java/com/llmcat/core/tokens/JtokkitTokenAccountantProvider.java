package com.llmcat.core.tokens;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * {@link TokenAccountantProvider} backed by jtokkit's BPE encodings.
 * <p>
 * Supported encodings are {@code cl100k_base}, {@code o200k_base},
 * {@code p50k_base}, {@code p50k_edit} and {@code r50k_base}.
 */
@Component
public class JtokkitTokenAccountantProvider implements TokenAccountantProvider {

    private static final Logger log = LoggerFactory.getLogger(JtokkitTokenAccountantProvider.class);

    public static final Set<String> SUPPORTED_ENCODINGS = Set.of(
            "cl100k_base", "o200k_base", "p50k_base", "p50k_edit", "r50k_base"
    );

    private final EncodingRegistry registry;

    public JtokkitTokenAccountantProvider() {
        this(Encodings.newLazyEncodingRegistry());
    }

    JtokkitTokenAccountantProvider(EncodingRegistry registry) {
        this.registry = registry;
    }

    @Override
    public TokenAccountant open(String encoding) {
        if (encoding == null || !SUPPORTED_ENCODINGS.contains(encoding)) {
            throw new TokenizerInitException(encoding,
                    "Unsupported tokenizer encoding '" + encoding + "'. Supported: "
                            + String.join(", ", SUPPORTED_ENCODINGS.stream().sorted().toList()));
        }

        Optional<Encoding> loaded;
        try {
            loaded = registry.getEncoding(encoding);
        } catch (RuntimeException e) {
            throw new TokenizerInitException(encoding,
                    "Failed to initialize tokenizer with encoding '" + encoding + "': " + e.getMessage(), e);
        }
        if (loaded.isEmpty()) {
            throw new TokenizerInitException(encoding,
                    "Failed to initialize tokenizer with encoding '" + encoding + "'");
        }

        log.debug("Initialized tokenizer with encoding {}", encoding);
        return new JtokkitTokenAccountant(encoding, loaded.get());
    }
}
