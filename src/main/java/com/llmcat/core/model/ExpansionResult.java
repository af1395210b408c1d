package com.llmcat.core.model;

import java.util.List;

/**
 * Output of target expansion: the listing and the tasks, both in target order.
 */
public record ExpansionResult(StructureListing listing, List<FileTask> tasks) {

    public ExpansionResult {
        tasks = List.copyOf(tasks);
    }
}
