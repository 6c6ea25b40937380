package com.streamfirst.history.ports;

import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.Timetoken;

import java.util.List;
import java.util.Map;

/**
 * Port for the upstream message history (storage) API.
 *
 * <p>The upstream returns at most 100 records per call, the ones nearest to the supplied
 * cursor, and paginates only through the {@code start}/{@code end} timetoken cursors.
 * Callers must not assume anything about the order of the returned list.
 *
 * <p>Implementations report every failure (connection errors, error statuses, timeouts)
 * as {@link HistoryTransportException} and never retry on their own.
 */
public interface HistoryPort {

    /**
     * Reads one page of history for a channel.
     *
     * @param query channel, page size and cursors
     * @return up to {@code query.count()} records, in no guaranteed order; empty when the
     *     cursors select nothing
     * @throws HistoryTransportException if the call fails
     */
    List<HistoryRecord> fetchHistory(HistoryQuery query);

    /**
     * Reads one page of history with the default fetch flags.
     *
     * @see #fetchHistory(HistoryQuery)
     */
    default List<HistoryRecord> fetchHistory(String channel, int count, Timetoken start, Timetoken end) {
        return fetchHistory(HistoryQuery.of(channel, count, start, end));
    }

    /**
     * Counts the messages published on each channel after a timetoken.
     *
     * @param channels channels to count
     * @param since exclusive lower bound
     * @return count per channel; channels with no messages may be absent
     * @throws HistoryTransportException if the call fails
     */
    Map<String, Integer> countMessagesSince(List<String> channels, Timetoken since);

    /**
     * Deletes the messages in {@code (start, end]} from a channel's history.
     *
     * @param channel channel to delete from
     * @param start exclusive lower bound
     * @param end inclusive upper bound
     * @throws HistoryTransportException if the upstream rejects or fails the call; the status
     *     code, service and message identify the rejection
     */
    void deleteRange(String channel, Timetoken start, Timetoken end);
}
