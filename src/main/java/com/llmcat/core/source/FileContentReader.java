package com.llmcat.core.source;

import com.llmcat.core.config.LlmcatProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads files whole, refusing anything above {@code llmcat.max-file-bytes}
 * (10 MiB by default).
 */
@Component
public class FileContentReader implements ContentReader {

    public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;

    private final long maxBytes;

    @Autowired
    public FileContentReader(LlmcatProperties properties) {
        this(properties.getMaxFileBytes());
    }

    public FileContentReader(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    @Override
    public byte[] read(Path file) throws IOException {
        long size = Files.size(file);
        if (size > maxBytes) {
            throw new ContentTooLargeException(file.toString(), size, maxBytes);
        }
        // The size can change between stat and read, so the stream is bounded as well.
        try (InputStream in = Files.newInputStream(file)) {
            byte[] content = in.readNBytes((int) Math.min(maxBytes, Integer.MAX_VALUE - 8));
            if (in.read() != -1) {
                throw new ContentTooLargeException(file.toString(), Files.size(file), maxBytes);
            }
            return content;
        }
    }
}
