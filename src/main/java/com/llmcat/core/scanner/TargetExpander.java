package com.llmcat.core.scanner;

import com.llmcat.core.filter.ExclusionFilter;
import com.llmcat.core.model.ExpansionResult;
import com.llmcat.core.model.FileTask;
import com.llmcat.core.model.PathNames;
import com.llmcat.core.model.StructureListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Expands raw targets into a {@link StructureListing} and an ordered list of
 * {@link FileTask}s.
 * <p>
 * Targets are handled in caller order. URLs become one listing line and one task
 * each. A local target matching the filter is dropped before anything else; the
 * rest are resolved against the base directory, and one that cannot be stat'ed is
 * listed verbatim and produces no task. Directories are walked
 * depth-first with children sorted by name, and every entry must pass the
 * {@link ExclusionFilter} both as {@code target/entry} and as the bare relative
 * entry path. Listing and tasks are built in the same pass, so both always see the
 * same exclusion decisions. A directory that cannot be listed is logged and its
 * contents are left out.
 */
public class TargetExpander {

    private static final Logger log = LoggerFactory.getLogger(TargetExpander.class);

    private final Path baseDirectory;
    private final ExclusionFilter filter;

    public TargetExpander(Path baseDirectory, ExclusionFilter filter) {
        this.baseDirectory = baseDirectory;
        this.filter = filter;
    }

    /**
     * Expands the given targets.
     *
     * @param targets files, directories and URLs, in the order they should appear
     * @return the listing and the tasks
     */
    public ExpansionResult expand(List<String> targets) {
        var lines = new ArrayList<String>();
        var tasks = new ArrayList<FileTask>();

        for (String target : targets) {
            if (PathNames.isUrl(target)) {
                lines.add("URL: " + target);
                tasks.add(FileTask.ofUrl(target));
                continue;
            }

            if (filter.excludes(target)) {
                log.debug("Target {} matches an exclusion pattern, skipping", target);
                continue;
            }

            BasicFileAttributes attrs = stat(baseDirectory.resolve(target));
            if (attrs == null) {
                log.debug("Cannot stat target {}, listing it verbatim", target);
                lines.add(target);
                continue;
            }

            if (attrs.isDirectory()) {
                lines.add(PathNames.asDirectory(target));
                Path root = baseDirectory.resolve(target);
                walkDirectory(root, root, target, lines, tasks);
            } else {
                lines.add(target);
                if (attrs.isRegularFile()) {
                    tasks.add(FileTask.ofFile(target));
                }
            }
        }

        log.debug("Expanded {} targets into {} listing lines and {} tasks",
                targets.size(), lines.size(), tasks.size());
        return new ExpansionResult(new StructureListing(lines), tasks);
    }

    private void walkDirectory(Path root, Path dir, String target,
                               List<String> lines, List<FileTask> tasks) {
        List<Path> children;
        try (var stream = Files.list(dir)) {
            children = stream.sorted().collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            log.warn("Cannot list directory {}: {}", dir, e.getMessage());
            return;
        }

        for (Path child : children) {
            String relative = PathNames.toSlashPath(root.relativize(child));
            boolean directory = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);

            if (retained(target, relative)) {
                String display = PathNames.join(target, relative);
                if (directory) {
                    lines.add(PathNames.asDirectory(display));
                } else {
                    lines.add(display);
                    if (Files.isRegularFile(child, LinkOption.NOFOLLOW_LINKS)) {
                        tasks.add(FileTask.ofEntry(target, relative));
                    }
                }
            }

            // Exclusion does not prune: every descendant is judged on its own paths.
            if (directory) {
                walkDirectory(root, child, target, lines, tasks);
            }
        }
    }

    /**
     * Returns {@code true} when the entry passes the filter both joined with its
     * target and as a bare relative path.
     */
    boolean retained(String target, String relative) {
        return !filter.excludes(PathNames.join(target, relative)) && !filter.excludes(relative);
    }

    private static BasicFileAttributes stat(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException e) {
            return null;
        }
    }
}
