package com.llmcat.handoff;

import com.llmcat.core.model.AggregationResult;

import java.io.PrintStream;

/**
 * Writes the document to a stream, normally {@code System.out}.
 */
public class PrintSink implements ResultSink {

    private final PrintStream out;

    public PrintSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public String name() {
        return "print";
    }

    @Override
    public void deliver(AggregationResult result) throws SinkException {
        out.write(result.content(), 0, result.content().length);
        out.flush();
        if (out.checkError()) {
            throw new SinkException("Failed to print document");
        }
    }
}
