package com.llmcat.handoff;

import java.nio.file.Path;

/**
 * Which dispositions the caller asked for.
 *
 * @param print  write the document to stdout
 * @param output file to write the document to, or {@code null}
 */
public record HandoffOptions(boolean print, Path output) {}
