package com.llmcat.handoff;

import com.llmcat.core.model.AggregationResult;

/**
 * A destination for the finished document.
 */
public interface ResultSink {

    /** Short name used in reports, e.g. "print" or "clipboard". */
    String name();

    void deliver(AggregationResult result) throws SinkException;
}
