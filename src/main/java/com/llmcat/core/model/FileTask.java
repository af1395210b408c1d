package com.llmcat.core.model;

/**
 * One unit of work: a single file or a single URL, claimed by exactly one worker.
 *
 * @param path         the URL, the full file path, or the path relative to {@code originTarget}
 * @param originTarget the directory target this entry was found under, {@code null} for full paths
 * @param fullPath     whether {@code path} already names the file without joining
 * @param url          whether this task is a remote fetch
 */
public record FileTask(
    String path,
    String originTarget,
    boolean fullPath,
    boolean url
) {

    public static FileTask ofUrl(String url) {
        return new FileTask(url, null, true, true);
    }

    public static FileTask ofFile(String path) {
        return new FileTask(path, null, true, false);
    }

    public static FileTask ofEntry(String target, String relativePath) {
        return new FileTask(relativePath, target, false, false);
    }

    /**
     * The location this task reads: the URL, or the file path with the
     * origin target joined in front when needed.
     */
    public String location() {
        if (fullPath || originTarget == null) {
            return path;
        }
        return PathNames.join(originTarget, path);
    }
}
