package com.llmcat.core.model;

import java.nio.charset.StandardCharsets;

/**
 * The finalized document and its token total, handed to the sinks.
 *
 * @param content     structure section followed by every task fragment
 * @param tokenTotal  sum of the token counts of all successful tasks
 * @param taskCount   number of tasks processed
 * @param failedTasks number of tasks rendered as inline errors
 * @param workers     worker threads spawned, 0 when the tasks ran on the calling thread
 */
public record AggregationResult(
    byte[] content,
    long tokenTotal,
    int taskCount,
    int failedTasks,
    int workers
) {

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
