package com.llmcat.core.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExclusionFilterTest {

    @Nested
    @DisplayName("Matching rules")
    class Rules {

        @Test
        @DisplayName("exact match excludes")
        void exactMatch() {
            assertTrue(ExclusionFilter.exclude("build.gradle", List.of("build.gradle")));
        }

        @Test
        @DisplayName("suffix match excludes")
        void suffixMatch() {
            assertTrue(ExclusionFilter.exclude("src/app.lock", List.of(".lock")));
        }

        @Test
        @DisplayName("substring anywhere excludes")
        void substringMatch() {
            assertTrue(ExclusionFilter.exclude("web/node_modules/react/index.js", List.of("node_modules")));
        }

        @Test
        @DisplayName("directory prefix matches with or without trailing slash in the pattern")
        void directoryPrefix() {
            assertTrue(ExclusionFilter.exclude("target/classes/App.class", List.of("target")));
            assertTrue(ExclusionFilter.exclude("target/classes/App.class", List.of("target/")));
        }

        @Test
        @DisplayName("unrelated path is kept")
        void unrelatedPathKept() {
            assertFalse(ExclusionFilter.exclude("src/main/App.java", List.of("test", ".md", "docs/")));
        }

        @Test
        @DisplayName("empty pattern set excludes nothing")
        void emptyPatternSet() {
            assertFalse(ExclusionFilter.exclude("anything", List.of()));
            assertFalse(ExclusionFilter.of(List.of()).excludes("anything"));
            assertFalse(ExclusionFilter.of(null).excludes("anything"));
        }

        @Test
        @DisplayName("a single-character pattern is deliberately permissive")
        void singleCharacterPatternIsBroad() {
            var filter = ExclusionFilter.of(List.of("a"));
            assertTrue(filter.excludes("src/main/java/App.java"));
            assertTrue(filter.excludes("data.txt"));
            assertFalse(filter.excludes("README"));
        }
    }

    @Test
    @DisplayName("any pattern in the set is enough")
    void anyPatternMatches() {
        var filter = ExclusionFilter.of(List.of("docs", ".log", "vendor/"));
        assertTrue(filter.excludes("server.log"));
        assertTrue(filter.excludes("vendor/lib.c"));
        assertTrue(filter.excludes("docs"));
        assertFalse(filter.excludes("src/main.c"));
    }

    @Test
    @DisplayName("decision equals the disjunction of the four rules")
    void equivalentToRuleDisjunction() {
        var paths = List.of("a", "a/b", "a/b/c.txt", "x.txt", "sub/", "sub", "b.txt", "");
        var patterns = List.of("a", "b/", ".txt", "sub", "c", "z", "/");
        for (String path : paths) {
            for (String pattern : patterns) {
                String dir = pattern.endsWith("/") ? pattern : pattern + "/";
                boolean expected = path.equals(pattern) || path.endsWith(pattern)
                        || path.contains(pattern) || path.startsWith(dir);
                assertEquals(expected, ExclusionFilter.exclude(path, List.of(pattern)),
                        () -> "path='" + path + "' pattern='" + pattern + "'");
            }
        }
    }

    @Test
    @DisplayName("patterns are copied on construction")
    void patternsAreCopied() {
        var patterns = new java.util.ArrayList<>(List.of("tmp"));
        var filter = ExclusionFilter.of(patterns);
        patterns.add("src");
        assertTrue(filter.excludes("build/tmp/x"));
        assertFalse(filter.excludes("src/App.java"));
    }
}
