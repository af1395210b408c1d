package com.llmcat.core.source;

import java.io.IOException;

/**
 * Fetches the body of a remote text resource with a single GET.
 */
@FunctionalInterface
public interface UrlFetcher {

    /**
     * @throws FetchFailedException if the server answers with a non-2xx status
     * @throws IOException          on any transport failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    byte[] fetch(String url) throws IOException, InterruptedException;
}
