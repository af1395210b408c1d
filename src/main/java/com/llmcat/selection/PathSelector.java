package com.llmcat.selection;

import java.nio.file.Path;
import java.util.List;

/**
 * Lets the user pick targets interactively.
 */
@FunctionalInterface
public interface PathSelector {

    /**
     * @param root directory whose files are offered
     * @return the selected paths relative to {@code root}, possibly empty
     */
    List<String> select(Path root) throws SelectionException;
}
