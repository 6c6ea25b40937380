package com.streamfirst.history.domain;

import java.util.Optional;

/**
 * Optional time window for a retrieval. {@code start} is exclusive, {@code end} is inclusive.
 *
 * @param start exclusive lower bound, or null
 * @param end inclusive upper bound, or null
 */
public record WindowBound(Timetoken start, Timetoken end) {

    private static final WindowBound UNBOUNDED = new WindowBound(null, null);

    public WindowBound {
        if (start != null && end != null && !start.isBefore(end)) {
            throw new IllegalArgumentException(
                "Window start " + start + " must be before end " + end);
        }
    }

    public static WindowBound unbounded() {
        return UNBOUNDED;
    }

    public static WindowBound after(Timetoken start) {
        return new WindowBound(start, null);
    }

    public static WindowBound until(Timetoken end) {
        return new WindowBound(null, end);
    }

    public static WindowBound between(Timetoken start, Timetoken end) {
        return new WindowBound(start, end);
    }

    public Optional<Timetoken> startBound() {
        return Optional.ofNullable(start);
    }

    public Optional<Timetoken> endBound() {
        return Optional.ofNullable(end);
    }

    /** The pagination policy implied by which bounds are present. */
    public WindowMode mode() {
        return WindowMode.of(this);
    }

    /** True if the token falls inside the window. */
    public boolean contains(Timetoken timetoken) {
        return (start == null || timetoken.isAfter(start))
            && (end == null || !timetoken.isAfter(end));
    }
}
