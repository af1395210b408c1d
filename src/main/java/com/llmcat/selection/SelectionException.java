package com.llmcat.selection;

/**
 * Thrown when interactive selection cannot run or is aborted.
 */
public class SelectionException extends Exception {
    public SelectionException(String message) {
        super(message);
    }

    public SelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
