package com.llmcat.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("PathNames")
    class PathNamesTests {

        @Test
        void joinUsesExactlyOneSeparator() {
            assertEquals("sub/b.txt", PathNames.join("sub/", "b.txt"));
            assertEquals("sub/b.txt", PathNames.join("sub", "b.txt"));
            assertEquals("b.txt", PathNames.join("", "b.txt"));
        }

        @Test
        void asDirectoryAddsTrailingSeparatorOnce() {
            assertEquals("src/", PathNames.asDirectory("src"));
            assertEquals("src/", PathNames.asDirectory("src/"));
        }

        @Test
        void toSlashPathJoinsComponents() {
            assertEquals("a/b/c.txt", PathNames.toSlashPath(Path.of("a", "b", "c.txt")));
        }

        @Test
        void urlRecognizedByScheme() {
            assertTrue(PathNames.isUrl("http://example.com"));
            assertTrue(PathNames.isUrl("https://example.com/x"));
            assertFalse(PathNames.isUrl("ftp://example.com"));
            assertFalse(PathNames.isUrl("httpdocs/index.html"));
        }
    }

    @Nested
    @DisplayName("FileTask")
    class FileTaskTests {

        @Test
        void entryLocationJoinsOriginTarget() {
            FileTask task = FileTask.ofEntry("sub/", "deep/b.txt");
            assertFalse(task.fullPath());
            assertEquals("sub/deep/b.txt", task.location());
        }

        @Test
        void fullPathLocationIsPathItself() {
            assertEquals("a.txt", FileTask.ofFile("a.txt").location());
            FileTask url = FileTask.ofUrl("https://example.com");
            assertTrue(url.url());
            assertEquals("https://example.com", url.location());
        }
    }

    @Test
    @DisplayName("structure listing renders header, one line per entry and a blank line")
    void structureRender() {
        assertEquals("[ STRUCTURE ]\na.txt\nsub/\n\n", new StructureListing(List.of("a.txt", "sub/")).render());
        assertEquals("[ STRUCTURE ]\n\n", new StructureListing(List.of()).render());
    }

    @Test
    @DisplayName("request copies its lists and defaults nulls")
    void requestDefaults() {
        var targets = new ArrayList<>(List.of("a.txt"));
        var request = new AggregationRequest(targets, null, 4, "cl100k_base", null);
        targets.add("b.txt");

        assertEquals(List.of("a.txt"), request.targets());
        assertTrue(request.exclusions().isEmpty());
        assertTrue(request.baseDirectory().isAbsolute());
    }

    @Test
    @DisplayName("result decodes its content as UTF-8")
    void resultContent() {
        var result = new AggregationResult("héllo".getBytes(StandardCharsets.UTF_8), 2, 1, 0, 0);
        assertEquals("héllo", result.contentAsString());
    }
}
