package com.llmcat.selection;

import com.llmcat.core.config.LlmcatProperties;
import com.llmcat.core.model.PathNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Offers every regular file below the root to {@code fzf -m} and returns the
 * selected lines. The fzf UI draws on the terminal through the inherited stderr.
 */
@Component
public class FzfPathSelector implements PathSelector {

    private static final Logger log = LoggerFactory.getLogger(FzfPathSelector.class);

    private static final int MAX_SELECTION_BYTES = 1024 * 1024;

    private final List<String> command;

    @Autowired
    public FzfPathSelector(LlmcatProperties properties) {
        this(properties.getSelector().args());
    }

    public FzfPathSelector(List<String> command) {
        this.command = List.copyOf(command);
    }

    @Override
    public List<String> select(Path root) throws SelectionException {
        if (command.isEmpty()) {
            throw new SelectionException("No selector command configured");
        }
        List<String> candidates = candidates(root);
        String input = candidates.stream().map(c -> c + "\n").collect(Collectors.joining());

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(root.toFile())
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new SelectionException(command.get(0) + " is not installed or not in PATH", e);
        }

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input.getBytes(StandardCharsets.UTF_8));
            }
            byte[] selected;
            try (InputStream stdout = process.getInputStream()) {
                selected = stdout.readNBytes(MAX_SELECTION_BYTES);
            }
            int exit = process.waitFor();
            if (exit != 0) {
                throw new SelectionException(command.get(0) + " exited with " + exit);
            }
            return parseSelection(new String(selected, StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroy();
            throw new SelectionException("Selection failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new SelectionException("Selection interrupted", e);
        }
    }

    /**
     * Regular files below {@code root}, relative and {@code /}-separated, in walk order.
     */
    static List<String> candidates(Path root) throws SelectionException {
        try (var stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .map(p -> PathNames.toSlashPath(root.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new SelectionException("Cannot list files under " + root + ": " + e.getMessage(), e);
        }
    }

    static List<String> parseSelection(String output) {
        var selected = new ArrayList<String>();
        for (String line : output.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                selected.add(trimmed);
            }
        }
        log.debug("Selected {} paths", selected.size());
        return selected;
    }
}
