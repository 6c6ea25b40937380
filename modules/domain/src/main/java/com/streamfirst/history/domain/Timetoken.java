package com.streamfirst.history.domain;

import java.time.Instant;

/**
 * Upstream storage timestamp: a count of 100-nanosecond ticks since the Unix epoch.
 * Used both as the timestamp of a stored message and as a pagination cursor.
 *
 * <p>Values are around 1.7e16 today, well past the range a double can represent exactly,
 * so all arithmetic stays on {@code long}.
 *
 * @param value ticks since 1970-01-01T00:00:00Z
 */
public record Timetoken(long value) implements Comparable<Timetoken> {

    /** Ticks per millisecond. */
    public static final long TICKS_PER_MILLI = 10_000L;

    /** Ticks per second. */
    public static final long TICKS_PER_SECOND = 10_000_000L;

    /** Nanoseconds per tick. */
    public static final long NANOS_PER_TICK = 100L;

    public Timetoken {
        if (value < 0) {
            throw new IllegalArgumentException("Timetoken cannot be negative: " + value);
        }
    }

    public static Timetoken of(long value) {
        return new Timetoken(value);
    }

    /**
     * Parses the decimal string form used on the wire.
     *
     * @throws IllegalArgumentException if the text is blank or not a non-negative integer
     */
    public static Timetoken parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Timetoken text cannot be blank");
        }
        try {
            return new Timetoken(Long.parseLong(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a timetoken: " + text, e);
        }
    }

    public static Timetoken fromEpochMillis(long epochMillis) {
        return new Timetoken(Math.multiplyExact(epochMillis, TICKS_PER_MILLI));
    }

    public static Timetoken fromInstant(Instant instant) {
        long ticks = Math.addExact(
            Math.multiplyExact(instant.getEpochSecond(), TICKS_PER_SECOND),
            instant.getNano() / NANOS_PER_TICK);
        return new Timetoken(ticks);
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(
            Math.floorDiv(value, TICKS_PER_SECOND),
            Math.floorMod(value, TICKS_PER_SECOND) * NANOS_PER_TICK);
    }

    /** Milliseconds since the epoch, truncated. */
    public long toEpochMillis() {
        return value / TICKS_PER_MILLI;
    }

    /** The token one tick earlier. */
    public Timetoken previous() {
        return new Timetoken(value - 1);
    }

    /** The token one tick later. */
    public Timetoken next() {
        return new Timetoken(Math.addExact(value, 1L));
    }

    public boolean isBefore(Timetoken other) {
        return value < other.value;
    }

    public boolean isAfter(Timetoken other) {
        return value > other.value;
    }

    @Override
    public int compareTo(Timetoken other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
