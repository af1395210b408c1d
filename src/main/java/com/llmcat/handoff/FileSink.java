package com.llmcat.handoff;

import com.llmcat.core.model.AggregationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the document to a file, replacing any previous content.
 */
public class FileSink implements ResultSink {

    private final Path target;

    public FileSink(Path target) {
        this.target = target;
    }

    @Override
    public String name() {
        return "file";
    }

    @Override
    public void deliver(AggregationResult result) throws SinkException {
        try {
            Files.write(target, result.content());
        } catch (IOException e) {
            throw new SinkException("Failed to write " + target + ": " + e.getMessage(), e);
        }
    }
}
