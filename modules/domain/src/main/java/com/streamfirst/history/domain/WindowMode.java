package com.streamfirst.history.domain;

/**
 * Pagination policy, fixed for a session by which window bounds the caller supplied.
 */
public enum WindowMode {
    /** No bounds: walk backward from now by moving {@code end}. */
    UNBOUNDED(false),
    /** Only {@code start}: walk forward by moving {@code start}. */
    START_ONLY(true),
    /** Only {@code end}: walk backward by moving {@code end}. */
    END_ONLY(false),
    /** Both bounds: walk forward by moving {@code start} until it reaches {@code end}. */
    BOUNDED(true);

    private final boolean forward;

    WindowMode(boolean forward) {
        this.forward = forward;
    }

    /** True if the session walks from old to new records. */
    public boolean walksForward() {
        return forward;
    }

    public static WindowMode of(WindowBound window) {
        boolean hasStart = window.start() != null;
        boolean hasEnd = window.end() != null;
        if (hasStart && hasEnd) {
            return BOUNDED;
        }
        if (hasStart) {
            return START_ONLY;
        }
        return hasEnd ? END_ONLY : UNBOUNDED;
    }
}
