package com.streamfirst.history.domain;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A multi-channel history retrieval: for each channel, up to {@code targetCount} records
 * inside {@code window}.
 *
 * @param channels channels to read, in result order; duplicates are rejected
 * @param targetCount desired record count per channel
 * @param window optional time bounds shared by all channels
 */
public record RetrievalRequest(List<String> channels, int targetCount, WindowBound window) {

    public RetrievalRequest {
        Objects.requireNonNull(channels, "Channels cannot be null");
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("At least one channel is required");
        }
        Set<String> distinct = new HashSet<>();
        for (String channel : channels) {
            if (channel == null || channel.isBlank()) {
                throw new IllegalArgumentException("Channel names cannot be blank");
            }
            if (!distinct.add(channel)) {
                throw new IllegalArgumentException("Channel listed more than once: " + channel);
            }
        }
        if (targetCount <= 0) {
            throw new IllegalArgumentException("Target count must be positive: " + targetCount);
        }
        channels = List.copyOf(channels);
        window = window == null ? WindowBound.unbounded() : window;
    }

    public static RetrievalRequest of(String channel, int targetCount) {
        return new RetrievalRequest(List.of(channel), targetCount, WindowBound.unbounded());
    }

    /**
     * Parses a comma separated channel list such as {@code "alerts, orders,,chat"}.
     * Entries are trimmed and blanks dropped.
     *
     * @throws IllegalArgumentException if no channel remains
     */
    public static List<String> parseChannels(String commaSeparated) {
        if (commaSeparated == null) {
            throw new IllegalArgumentException("At least one channel is required");
        }
        List<String> channels = Arrays.stream(commaSeparated.split(","))
            .map(String::trim)
            .filter(c -> !c.isEmpty())
            .distinct()
            .toList();
        if (channels.isEmpty()) {
            throw new IllegalArgumentException("At least one channel is required");
        }
        return channels;
    }

    /** Target record count summed over every channel. */
    public int totalTarget() {
        return Math.multiplyExact(targetCount, channels.size());
    }
}
