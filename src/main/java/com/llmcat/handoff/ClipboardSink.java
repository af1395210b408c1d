package com.llmcat.handoff;

import com.llmcat.core.model.AggregationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the document to the system clipboard.
 * <p>
 * Under Wayland ({@code WAYLAND_DISPLAY} set) {@code wl-copy} is tried first; if it
 * is missing or fails, the X11 command ({@code xclip -selection clipboard}) is used.
 */
public class ClipboardSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(ClipboardSink.class);

    private final CommandRunner runner;
    private final List<String> waylandCommand;
    private final List<String> x11Command;
    private final boolean wayland;

    public ClipboardSink(CommandRunner runner, List<String> waylandCommand, List<String> x11Command,
                         boolean wayland) {
        this.runner = runner;
        this.waylandCommand = waylandCommand;
        this.x11Command = x11Command;
        this.wayland = wayland;
    }

    @Override
    public String name() {
        return "clipboard";
    }

    /** Commands in the order they will be attempted. */
    List<List<String>> candidates() {
        var commands = new ArrayList<List<String>>();
        if (wayland && !waylandCommand.isEmpty()) {
            commands.add(waylandCommand);
        }
        if (!x11Command.isEmpty()) {
            commands.add(x11Command);
        }
        return commands;
    }

    @Override
    public void deliver(AggregationResult result) throws SinkException {
        String lastFailure = "no clipboard command configured";
        for (List<String> command : candidates()) {
            try {
                int exit = runner.run(command, result.content());
                if (exit == 0) {
                    log.debug("Copied {} bytes with {}", result.content().length, command.get(0));
                    return;
                }
                lastFailure = command.get(0) + " exited with " + exit;
            } catch (IOException e) {
                lastFailure = command.get(0) + ": " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SinkException("Interrupted while copying to clipboard", e);
            }
            log.debug("Clipboard command failed: {}", lastFailure);
        }
        throw new SinkException("Clipboard copy failed: " + lastFailure);
    }
}
