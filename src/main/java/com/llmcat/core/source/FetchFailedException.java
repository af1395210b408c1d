package com.llmcat.core.source;

import java.io.IOException;

/**
 * Thrown when a URL answers with a non-2xx status.
 */
public class FetchFailedException extends IOException {

    private final int statusCode;

    public FetchFailedException(String url, int statusCode) {
        super("HTTP " + statusCode + " from " + url);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
