package com.streamfirst.history.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final outcome for one requested channel. Always produced, even on failure, in which case
 * {@code records} holds whatever was accumulated (usually nothing) and {@code error} is set.
 *
 * @param channel channel name
 * @param records unique records sorted by timetoken ascending
 * @param error failure detail, or null on success
 */
public record ChannelResult(String channel, List<HistoryRecord> records, ChannelError error) {

    public ChannelResult {
        Objects.requireNonNull(channel, "Channel cannot be null");
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static ChannelResult success(String channel, List<HistoryRecord> records) {
        return new ChannelResult(channel, records, null);
    }

    public static ChannelResult failure(String channel, ChannelError error) {
        return new ChannelResult(channel, List.of(), Objects.requireNonNull(error));
    }

    public static ChannelResult partial(String channel, List<HistoryRecord> records, ChannelError error) {
        return new ChannelResult(channel, records, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ChannelError> errorDetail() {
        return Optional.ofNullable(error);
    }

    public int totalMessages() {
        return records.size();
    }

    public Optional<Timetoken> oldestTimetoken() {
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0).getTimetoken());
    }

    public Optional<Timetoken> newestTimetoken() {
        return records.isEmpty()
            ? Optional.empty()
            : Optional.of(records.get(records.size() - 1).getTimetoken());
    }

    /** Same channel and error, different records. */
    public ChannelResult withRecords(List<HistoryRecord> replacement) {
        return new ChannelResult(channel, replacement, error);
    }
}
