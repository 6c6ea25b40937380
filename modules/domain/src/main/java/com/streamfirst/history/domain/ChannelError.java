package com.streamfirst.history.domain;

import java.util.Objects;

/**
 * Why a channel's retrieval did not finish normally.
 *
 * @param kind failure class
 * @param message human readable detail
 */
public record ChannelError(Kind kind, String message) {

    public enum Kind {
        /** Network, upstream status or timeout failure from the history API */
        TRANSPORT,
        /** The session stopped making pagination progress */
        SAFETY_CAP_EXCEEDED,
        /** The request was cancelled before this channel finished */
        CANCELLED,
        /** Anything else thrown while processing the channel */
        UNEXPECTED
    }

    public ChannelError {
        Objects.requireNonNull(kind, "Error kind cannot be null");
        message = message == null ? kind.name() : message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
