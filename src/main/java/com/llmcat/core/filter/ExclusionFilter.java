package com.llmcat.core.filter;

import java.util.List;

/**
 * Decides whether a candidate path is suppressed by a set of exclusion patterns.
 * <p>
 * A path is excluded when, for any pattern (checked in order, first match wins):
 * <ul>
 *   <li>the path equals the pattern,</li>
 *   <li>the path ends with the pattern,</li>
 *   <li>the pattern occurs anywhere in the path, or</li>
 *   <li>the path starts with the pattern normalized to end with {@code /}.</li>
 * </ul>
 * Substring matching makes this coarse: a one-character pattern excludes nearly
 * every path. The behavior is kept literal; callers wanting precise matching
 * should pass longer patterns.
 */
public final class ExclusionFilter {

    private static final ExclusionFilter NONE = new ExclusionFilter(List.of());

    private final List<String> patterns;

    private ExclusionFilter(List<String> patterns) {
        this.patterns = patterns;
    }

    public static ExclusionFilter of(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return NONE;
        }
        return new ExclusionFilter(List.copyOf(patterns));
    }

    /**
     * Returns {@code true} if {@code path} matches any pattern of this filter.
     */
    public boolean excludes(String path) {
        return exclude(path, patterns);
    }

    /**
     * Pure form of {@link #excludes(String)} for an explicit pattern list.
     */
    public static boolean exclude(String path, List<String> patterns) {
        for (String pattern : patterns) {
            if (matches(path, pattern)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(String path, String pattern) {
        if (path.equals(pattern) || path.endsWith(pattern) || path.contains(pattern)) {
            return true;
        }
        String dirPattern = pattern.endsWith("/") ? pattern : pattern + "/";
        return path.startsWith(dirPattern);
    }
}
