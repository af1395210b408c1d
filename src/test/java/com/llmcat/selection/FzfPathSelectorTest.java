package com.llmcat.selection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FzfPathSelectorTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("candidates are sorted relative regular files with slash separators")
    void candidates() throws Exception {
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.writeString(tempDir.resolve("src/main/App.java"), "class App {}");
        Files.writeString(tempDir.resolve("README.md"), "# readme");
        Files.createDirectories(tempDir.resolve("empty"));

        assertEquals(List.of("README.md", "src/main/App.java"), FzfPathSelector.candidates(tempDir));
    }

    @Test
    @DisplayName("selection output is split into non-blank lines")
    void parseSelection() {
        assertEquals(List.of("a.txt", "sub/b.txt"), FzfPathSelector.parseSelection("a.txt\n\nsub/b.txt\r\n  \n"));
        assertTrue(FzfPathSelector.parseSelection("").isEmpty());
    }

    @Test
    @DisplayName("missing selector binary is a selection error")
    void missingBinary() {
        var selector = new FzfPathSelector(List.of("llmcat-no-such-selector-binary"));

        SelectionException e = assertThrows(SelectionException.class, () -> selector.select(tempDir));
        assertTrue(e.getMessage().contains("not installed"));
    }

    @Test
    @DisplayName("empty selector command is rejected")
    void emptyCommand() {
        assertThrows(SelectionException.class, () -> new FzfPathSelector(List.of()).select(tempDir));
    }
}
