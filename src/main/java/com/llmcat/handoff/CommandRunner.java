package com.llmcat.handoff;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command, feeding it {@code input} on stdin.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @return the process exit code
     * @throws IOException if the command cannot be started or written to
     */
    int run(List<String> command, byte[] input) throws IOException, InterruptedException;
}
