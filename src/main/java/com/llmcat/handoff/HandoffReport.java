package com.llmcat.handoff;

import java.util.List;

/**
 * Outcome of a handoff: the sinks that received the document and the failures.
 */
public record HandoffReport(List<String> delivered, List<String> failures) {

    public HandoffReport {
        delivered = List.copyOf(delivered);
        failures = List.copyOf(failures);
    }

    public boolean succeeded() {
        return failures.isEmpty();
    }

    public boolean deliveredTo(String sink) {
        return delivered.contains(sink);
    }
}
