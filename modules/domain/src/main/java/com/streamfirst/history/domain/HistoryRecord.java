package com.streamfirst.history.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A single message read back from channel history. Immutable once fetched.
 * Payload and meta are kept as the raw JSON text the upstream returned.
 */
@Value
@Builder(toBuilder = true)
public class HistoryRecord {

    /** Channel the message was published on */
    @NonNull String channel;

    /** Publish timetoken; the dedup key within a channel */
    @NonNull Timetoken timetoken;

    /** Message body as JSON text */
    @NonNull String payload;

    /** Publisher id, when requested and present */
    String publisher;

    /** Publish-time metadata as JSON text, when requested and present */
    String meta;

    /** Upstream message type marker, when requested and present */
    String recordType;

    public Optional<String> publisher() {
        return Optional.ofNullable(publisher);
    }

    public Optional<String> meta() {
        return Optional.ofNullable(meta);
    }

    public Optional<String> recordType() {
        return Optional.ofNullable(recordType);
    }
}
