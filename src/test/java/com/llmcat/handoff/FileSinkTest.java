package com.llmcat.handoff;

import com.llmcat.core.model.AggregationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSinkTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("overwrites an existing file with the document")
    void overwrites() throws Exception {
        Path out = tempDir.resolve("out.txt");
        Files.writeString(out, "a much longer previous content");
        var result = new AggregationResult("new".getBytes(StandardCharsets.UTF_8), 1, 0, 0, 0);

        new FileSink(out).deliver(result);

        assertEquals("new", Files.readString(out));
    }

    @Test
    @DisplayName("write into a directory fails with the target in the message")
    void writeFailure() {
        var result = new AggregationResult(new byte[0], 0, 0, 0, 0);
        var sink = new FileSink(tempDir);

        SinkException e = assertThrows(SinkException.class, () -> sink.deliver(result));
        assertTrue(e.getMessage().contains(tempDir.toString()));
    }
}
