package com.llmcat.handoff;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * {@link CommandRunner} on {@link ProcessBuilder}; stdout and stderr are discarded.
 */
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public int run(List<String> command, byte[] input) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
        }
        return process.waitFor();
    }
}
