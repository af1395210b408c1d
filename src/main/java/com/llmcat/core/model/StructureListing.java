package com.llmcat.core.model;

import java.util.List;

/**
 * Ordered description of every target and every retained directory descendant.
 * Built on a single thread before any task runs; it is the deterministic part
 * of the produced document.
 */
public record StructureListing(List<String> lines) {

    public static final String HEADER = "[ STRUCTURE ]";

    public StructureListing {
        lines = List.copyOf(lines);
    }

    /**
     * Renders the structure section: the header, one line per entry and a
     * terminating blank line.
     */
    public String render() {
        var sb = new StringBuilder(HEADER).append('\n');
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.append('\n').toString();
    }
}
