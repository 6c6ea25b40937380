package com.streamfirst.history.domain;

/**
 * Raised inside a channel session when the owning request was cancelled.
 */
public class RetrievalCancelledException extends RuntimeException {

    public RetrievalCancelledException(String message) {
        super(message);
    }
}
