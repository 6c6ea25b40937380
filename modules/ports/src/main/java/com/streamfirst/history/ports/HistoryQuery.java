package com.streamfirst.history.ports;

import com.streamfirst.history.domain.RetrievalOptions;
import com.streamfirst.history.domain.Timetoken;

import java.util.Objects;
import java.util.Optional;

/**
 * One bounded read against the upstream history API.
 *
 * @param channel channel to read
 * @param count maximum records to return, 1..100
 * @param start exclusive lower cursor, or null
 * @param end inclusive upper cursor, or null
 * @param includeMeta return publish-time metadata
 * @param includePublisher return publisher ids
 * @param includeRecordType return message type markers
 * @param includeMessageActions return message actions (single-channel reads only)
 */
public record HistoryQuery(
    String channel,
    int count,
    Timetoken start,
    Timetoken end,
    boolean includeMeta,
    boolean includePublisher,
    boolean includeRecordType,
    boolean includeMessageActions) {

    public HistoryQuery {
        Objects.requireNonNull(channel, "Channel cannot be null");
        if (count < 1 || count > RetrievalOptions.MAX_BATCH_CAP) {
            throw new IllegalArgumentException(
                "count must be between 1 and " + RetrievalOptions.MAX_BATCH_CAP + ": " + count);
        }
    }

    /** A query with the default fetch flags. */
    public static HistoryQuery of(String channel, int count, Timetoken start, Timetoken end) {
        return new HistoryQuery(channel, count, start, end, false, true, true, false);
    }

    /** A query carrying the fetch flags of the given options. */
    public static HistoryQuery of(String channel, int count, Timetoken start, Timetoken end,
                                  RetrievalOptions options, boolean singleChannel) {
        return new HistoryQuery(channel, count, start, end,
            options.isIncludeMeta(),
            options.isIncludePublisher(),
            options.isIncludeRecordType(),
            options.isIncludeMessageActions() && singleChannel);
    }

    public Optional<Timetoken> startCursor() {
        return Optional.ofNullable(start);
    }

    public Optional<Timetoken> endCursor() {
        return Optional.ofNullable(end);
    }
}
