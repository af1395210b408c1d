package com.llmcat.dispatch.cli;

import com.llmcat.core.config.LlmcatProperties;
import com.llmcat.core.engine.AggregationEngine;
import com.llmcat.core.engine.AggregationException;
import com.llmcat.core.model.AggregationRequest;
import com.llmcat.core.model.AggregationResult;
import com.llmcat.handoff.HandoffOptions;
import com.llmcat.handoff.HandoffReport;
import com.llmcat.handoff.ResultHandoff;
import com.llmcat.selection.PathSelector;
import com.llmcat.selection.SelectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: llmcat [OPTIONS] [TARGETS...]
 * <p>
 * Aggregates the targets into one document, then prints it, writes it to a file or
 * copies it to the clipboard. With {@code -f}, or with no arguments at all, the
 * files of the working directory are offered through fzf. When no target yields a
 * task, only {@code -p} is honored and the listing alone is printed.
 */
@Command(
        name = "llmcat",
        mixinStandardHelpOptions = true,
        version = "llmcat 0.1.0",
        description = "Concatenates files, directories and URLs into one LLM-ready document and counts its tokens.",
        footer = {"", "TARGETS can be files, directory paths or URLs (http:// or https://)."}
)
@Component
public class LlmcatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LlmcatCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "TARGETS", description = "Files, directories or URLs to aggregate")
    private List<String> targets = new ArrayList<>();

    @Option(names = {"-p", "--print"}, description = "Print results to stdout")
    private boolean print;

    @Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write results to FILE")
    private Path output;

    @Option(names = {"-e", "--exclude"}, paramLabel = "PATTERN",
            description = "Exclude paths matching PATTERN (repeatable)")
    private List<String> exclude = new ArrayList<>();

    @Option(names = {"-t", "--threads"}, paramLabel = "N", description = "Number of worker threads (default: 4)")
    private Integer threads;

    @Option(names = {"-f", "--fzf"}, description = "Select files interactively with fzf")
    private boolean fzf;

    @Option(names = "--encoding", paramLabel = "NAME",
            description = "Tokenizer encoding: cl100k_base (default), o200k_base, p50k_base, p50k_edit, r50k_base")
    private String encoding;

    @Option(names = "--count-files", description = "Print the number of processed files")
    private boolean countFiles;

    @Option(names = "--count-tokens", description = "Only count tokens, do not print, save or copy content")
    private boolean countTokens;

    private final AggregationEngine engine;
    private final ResultHandoff handoff;
    private final PathSelector selector;
    private final LlmcatProperties properties;
    private final Path workingDirectory;

    @Autowired
    public LlmcatCommand(AggregationEngine engine, ResultHandoff handoff, PathSelector selector,
                         LlmcatProperties properties) {
        this(engine, handoff, selector, properties, Path.of("").toAbsolutePath());
    }

    LlmcatCommand(AggregationEngine engine, ResultHandoff handoff, PathSelector selector,
                  LlmcatProperties properties, Path workingDirectory) {
        this.engine = engine;
        this.handoff = handoff;
        this.selector = selector;
        this.properties = properties;
        this.workingDirectory = workingDirectory;
    }

    @Override
    public Integer call() {
        List<String> resolvedTargets = new ArrayList<>(targets);
        if (resolvedTargets.isEmpty()) {
            boolean noArguments = spec.commandLine().getParseResult().originalArgs().isEmpty();
            if (!fzf && !noArguments) {
                ConsoleOutput.error("No targets given.");
                spec.commandLine().usage(System.err);
                return 2;
            }
            log.debug("No targets given, falling back to interactive selection");
            try {
                resolvedTargets.addAll(selector.select(workingDirectory));
            } catch (SelectionException e) {
                ConsoleOutput.error(e.getMessage());
                return 1;
            }
            if (resolvedTargets.isEmpty()) {
                ConsoleOutput.error("No files selected.");
                spec.commandLine().usage(System.err);
                return 1;
            }
        }

        var request = new AggregationRequest(
                resolvedTargets,
                exclude,
                threads != null ? threads : properties.getThreads(),
                encoding != null ? encoding : properties.getEncoding(),
                workingDirectory);

        AggregationResult result;
        try {
            result = engine.aggregate(request);
        } catch (AggregationException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.failedTasks(result.failedTasks());

        if (result.taskCount() == 0) {
            ConsoleOutput.info("No target resolved to a readable file or URL");
            if (!print) {
                return 0;
            }
            HandoffReport report = handoff.deliver(result, new HandoffOptions(true, null));
            report.failures().forEach(ConsoleOutput::error);
            return report.succeeded() ? 0 : 1;
        }

        if (countTokens) {
            ConsoleOutput.tokenCount(result.tokenTotal(), countFiles ? result.taskCount() : -1);
            return 0;
        }

        Path outputPath = output != null ? workingDirectory.resolve(output) : null;
        HandoffReport report = handoff.deliver(result, new HandoffOptions(print, outputPath));

        if (report.deliveredTo("file")) {
            ConsoleOutput.written(String.valueOf(output), result.tokenTotal());
        } else if (report.deliveredTo("clipboard")) {
            ConsoleOutput.copied(result.tokenTotal(), countFiles ? result.taskCount() : -1);
        }

        for (String failure : report.failures()) {
            ConsoleOutput.error(failure);
        }
        return report.succeeded() ? 0 : 1;
    }
}
