package com.llmcat.core.model;

import java.nio.file.Path;

/**
 * Path string helpers shared by listing, filtering and reading so that all three
 * agree on one spelling of every path. The separator is always {@code /}.
 */
public final class PathNames {

    public static final String SEPARATOR = "/";

    private PathNames() {
        // utility class
    }

    /** Joins a target and a relative entry with exactly one separator between them. */
    public static String join(String target, String relative) {
        if (target.isEmpty()) {
            return relative;
        }
        return target.endsWith(SEPARATOR) ? target + relative : target + SEPARATOR + relative;
    }

    /** Appends a trailing separator unless one is already present. */
    public static String asDirectory(String path) {
        return path.endsWith(SEPARATOR) ? path : path + SEPARATOR;
    }

    /** Renders a relative {@link Path} with {@code /} between components. */
    public static String toSlashPath(Path relative) {
        var sb = new StringBuilder();
        for (Path component : relative) {
            if (sb.length() > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(component);
        }
        return sb.toString();
    }

    public static boolean isUrl(String target) {
        return target.startsWith("http://") || target.startsWith("https://");
    }
}
