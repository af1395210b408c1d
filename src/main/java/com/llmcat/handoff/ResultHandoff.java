package com.llmcat.handoff;

import com.llmcat.core.config.LlmcatProperties;
import com.llmcat.core.model.AggregationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Hands the finished document to its sinks.
 * <p>
 * Printing may be combined with either other disposition. A file is written when
 * an output path is given; otherwise, if printing was not requested, the document
 * goes to the clipboard. A failing sink is reported without affecting the others
 * or the document.
 */
@Service
public class ResultHandoff {

    private static final Logger log = LoggerFactory.getLogger(ResultHandoff.class);

    private final Supplier<PrintStream> stdout;
    private final Supplier<ResultSink> clipboard;

    @Autowired
    public ResultHandoff(LlmcatProperties properties) {
        this(() -> System.out, () -> new ClipboardSink(new ProcessCommandRunner(),
                properties.getClipboard().waylandArgs(),
                properties.getClipboard().x11Args(),
                System.getenv("WAYLAND_DISPLAY") != null));
    }

    public ResultHandoff(Supplier<PrintStream> stdout, Supplier<ResultSink> clipboard) {
        this.stdout = stdout;
        this.clipboard = clipboard;
    }

    /**
     * Sinks selected by {@code options}, in delivery order.
     */
    public List<ResultSink> plan(HandoffOptions options) {
        var sinks = new ArrayList<ResultSink>();
        if (options.print()) {
            sinks.add(new PrintSink(stdout.get()));
        }
        if (options.output() != null) {
            sinks.add(new FileSink(options.output()));
        } else if (!options.print()) {
            sinks.add(clipboard.get());
        }
        return sinks;
    }

    public HandoffReport deliver(AggregationResult result, HandoffOptions options) {
        var delivered = new ArrayList<String>();
        var failures = new ArrayList<String>();
        for (ResultSink sink : plan(options)) {
            try {
                sink.deliver(result);
                delivered.add(sink.name());
            } catch (SinkException e) {
                log.warn("Sink {} failed: {}", sink.name(), e.getMessage());
                failures.add(e.getMessage());
            }
        }
        return new HandoffReport(delivered, failures);
    }
}
