package com.llmcat.core.model;

/**
 * Private output of one task, built without holding any lock.
 *
 * @param bytes      header, content (or inline error) and blank-line terminator
 * @param tokenCount tokens counted for the content, 0 on failure
 * @param succeeded  whether the content was read or fetched
 */
public record Fragment(byte[] bytes, long tokenCount, boolean succeeded) {}
