package com.llmcat.core.dispatch;

import com.llmcat.core.aggregate.ResultAggregator;
import com.llmcat.core.logging.MdcContext;
import com.llmcat.core.metrics.AggregationMetrics;
import com.llmcat.core.model.FileTask;
import com.llmcat.core.model.Fragment;
import com.llmcat.core.source.ContentReader;
import com.llmcat.core.source.ContentTooLargeException;
import com.llmcat.core.source.FetchFailedException;
import com.llmcat.core.source.UrlFetcher;
import com.llmcat.core.tokens.TokenAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Turns one {@link FileTask} into a {@link Fragment} and merges it.
 * <p>
 * A fragment is a bracketed source header line, the content and a blank-line
 * terminator. When reading or fetching fails the content is replaced by an inline
 * diagnostic and the fragment contributes no tokens. Failures never leave this
 * class; only the final {@link ResultAggregator#merge(Fragment)} touches shared state.
 */
public class TaskProcessor implements TaskHandler<FileTask> {

    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);

    static final String TERMINATOR = "\n\n";

    private final Path baseDirectory;
    private final ContentReader reader;
    private final UrlFetcher fetcher;
    private final TokenAccountant tokens;
    private final ResultAggregator aggregator;
    private final String runId;
    private final AggregationMetrics metrics;

    public TaskProcessor(Path baseDirectory, ContentReader reader, UrlFetcher fetcher,
                         TokenAccountant tokens, ResultAggregator aggregator,
                         String runId, AggregationMetrics metrics) {
        this.baseDirectory = baseDirectory;
        this.reader = reader;
        this.fetcher = fetcher;
        this.tokens = tokens;
        this.aggregator = aggregator;
        this.runId = runId;
        this.metrics = metrics;
    }

    @Override
    public void handle(int index, FileTask task) {
        MdcContext.setTask(runId, index, task.location());
        try {
            Fragment fragment = process(task);
            aggregator.merge(fragment);
            if (metrics != null) {
                metrics.recordTask(task.url() ? "url" : "file", fragment.succeeded());
            }
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Builds the fragment for a task without touching shared state.
     */
    public Fragment process(FileTask task) {
        String location = task.location();
        String header = task.url() ? "[ URL: " + location + " ]\n" : "[ " + location + " ]\n";
        var out = new ByteArrayOutputStream();
        out.writeBytes(header.getBytes(StandardCharsets.UTF_8));

        byte[] content;
        try {
            content = task.url() ? fetcher.fetch(location) : reader.read(baseDirectory.resolve(location));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(out, task, "Interrupted");
        } catch (IOException e) {
            log.warn("Task {} failed: {}", location, e.getMessage());
            return failure(out, task, describe(e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure processing {}", location, e);
            return failure(out, task, describe(e));
        }

        long count;
        try {
            count = tokens.count(new String(content, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            log.error("Token counting failed for {}", location, e);
            return failure(out, task, "Token counting failed: " + describe(e));
        }

        out.writeBytes(content);
        out.writeBytes(TERMINATOR.getBytes(StandardCharsets.UTF_8));
        log.debug("Processed {} ({} bytes, {} tokens)", location, content.length, count);
        return new Fragment(out.toByteArray(), count, true);
    }

    private static Fragment failure(ByteArrayOutputStream out, FileTask task, String reason) {
        String prefix = task.url() ? "Error fetching URL: " : "Error reading file: ";
        out.writeBytes((prefix + reason + TERMINATOR).getBytes(StandardCharsets.UTF_8));
        return new Fragment(out.toByteArray(), 0, false);
    }

    static String describe(Exception e) {
        if (e instanceof NoSuchFileException) {
            return "File not found: " + e.getMessage();
        }
        if (e instanceof AccessDeniedException) {
            return "Access denied: " + e.getMessage();
        }
        if (e instanceof ContentTooLargeException || e instanceof FetchFailedException) {
            return e.getMessage();
        }
        String message = e.getMessage();
        return message != null ? e.getClass().getSimpleName() + ": " + message : e.getClass().getSimpleName();
    }
}
