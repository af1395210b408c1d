package com.llmcat.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@ConfigurationProperties(prefix = "llmcat")
public class LlmcatProperties {

    private static final Pattern COMMAND_TOKEN = Pattern.compile("\"([^\"]*)\"|(\\S+)");

    private int threads = 4;
    private String encoding = "cl100k_base";
    private long maxFileBytes = 10L * 1024 * 1024;
    private Fetch fetch = new Fetch();
    private Clipboard clipboard = new Clipboard();
    private Selector selector = new Selector();

    public int getThreads() { return threads; }
    public void setThreads(int threads) { this.threads = threads; }
    public String getEncoding() { return encoding; }
    public void setEncoding(String encoding) { this.encoding = encoding; }
    public long getMaxFileBytes() { return maxFileBytes; }
    public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }
    public Fetch getFetch() { return fetch; }
    public void setFetch(Fetch fetch) { this.fetch = fetch; }
    public Clipboard getClipboard() { return clipboard; }
    public void setClipboard(Clipboard clipboard) { this.clipboard = clipboard; }
    public Selector getSelector() { return selector; }
    public void setSelector(Selector selector) { this.selector = selector; }

    /**
     * Splits a configured command line on whitespace, keeping double-quoted
     * segments together: {@code fzf --preview "cat {}"} gives three arguments.
     */
    public static List<String> splitCommand(String command) {
        if (command == null || command.isBlank()) {
            return List.of();
        }
        var parts = new ArrayList<String>();
        Matcher m = COMMAND_TOKEN.matcher(command);
        while (m.find()) {
            parts.add(m.group(1) != null ? m.group(1) : m.group(2));
        }
        return parts;
    }

    public static class Fetch {
        private String userAgent = "llmcat/1.0";

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    public static class Clipboard {
        private String waylandCommand = "wl-copy";
        private String x11Command = "xclip -selection clipboard";

        public String getWaylandCommand() { return waylandCommand; }
        public void setWaylandCommand(String waylandCommand) { this.waylandCommand = waylandCommand; }
        public String getX11Command() { return x11Command; }
        public void setX11Command(String x11Command) { this.x11Command = x11Command; }

        public List<String> waylandArgs() { return splitCommand(waylandCommand); }
        public List<String> x11Args() { return splitCommand(x11Command); }
    }

    public static class Selector {
        private String command = "fzf -m --height=40% --border --preview \"cat {}\"";

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }

        public List<String> args() { return splitCommand(command); }
    }
}
