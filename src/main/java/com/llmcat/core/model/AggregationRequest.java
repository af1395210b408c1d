package com.llmcat.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything one aggregation run needs.
 *
 * @param targets       files, directories and URLs in caller order
 * @param exclusions    exclusion patterns applied to listing and tasks alike
 * @param threads       requested worker count, at least 1
 * @param encoding      tokenizer encoding name, e.g. {@code cl100k_base}
 * @param baseDirectory directory that relative local targets are resolved against
 */
public record AggregationRequest(
    List<String> targets,
    List<String> exclusions,
    int threads,
    String encoding,
    Path baseDirectory
) {

    public AggregationRequest {
        targets = targets == null ? List.of() : List.copyOf(targets);
        exclusions = exclusions == null ? List.of() : List.copyOf(exclusions);
        baseDirectory = baseDirectory == null ? Path.of("").toAbsolutePath() : baseDirectory;
    }
}
