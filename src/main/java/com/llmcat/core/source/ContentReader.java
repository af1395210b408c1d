package com.llmcat.core.source;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a whole local file into memory.
 */
@FunctionalInterface
public interface ContentReader {

    /**
     * @throws ContentTooLargeException if the file is larger than the read bound
     * @throws IOException              if the file cannot be read
     */
    byte[] read(Path file) throws IOException;
}
