package com.llmcat.core.source;

import java.io.IOException;

/**
 * Thrown when a file exceeds the configured read bound.
 */
public class ContentTooLargeException extends IOException {

    private final long size;
    private final long limit;

    public ContentTooLargeException(String location, long size, long limit) {
        super("File too big: " + location + " is " + size + " bytes, limit is " + limit);
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
