package com.streamfirst.history.adapters;

import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.ports.HistoryPort;
import com.streamfirst.history.ports.HistoryQuery;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * In-memory implementation of HistoryPort for testing and development.
 *
 * <p>Follows the upstream paging contract: a call returns at most {@code count} records inside
 * {@code (start, end]}, the ones nearest the driving cursor. With a {@code start} cursor that is
 * the oldest records after it; otherwise the newest records up to {@code end} (or now).
 * The order of the returned list is configurable so callers can be checked for not relying on it.
 * Failures, latency and a cursor-ignoring mode can be injected per channel.
 */
@Slf4j
public class InMemoryHistoryAdapter implements HistoryPort {

    /** Order in which fetched pages are handed back. */
    public enum ResponseOrder { ASCENDING, DESCENDING, SHUFFLED }

    private final Map<String, NavigableMap<Timetoken, HistoryRecord>> channels = new ConcurrentHashMap<>();
    private final Map<String, Supplier<? extends RuntimeException>> failures = new ConcurrentHashMap<>();
    private final Map<String, Duration> latencies = new ConcurrentHashMap<>();
    private final Map<String, Boolean> cursorIgnoring = new ConcurrentHashMap<>();
    private final List<HistoryQuery> calls = new CopyOnWriteArrayList<>();
    private final Random shuffle = new Random(42);
    private volatile ResponseOrder responseOrder = ResponseOrder.DESCENDING;
    private volatile HistoryTransportException deleteRejection;

    @Override
    public List<HistoryRecord> fetchHistory(HistoryQuery query) {
        calls.add(query);
        String channel = query.channel();

        Duration latency = latencies.get(channel);
        if (latency != null) {
            sleep(latency);
        }
        Supplier<? extends RuntimeException> failure = failures.get(channel);
        if (failure != null) {
            log.debug("Injecting failure for channel {}", channel);
            throw failure.get();
        }

        List<HistoryRecord> page = cursorIgnoring.getOrDefault(channel, false)
            ? newest(stored(channel), query.count())
            : page(stored(channel), query);

        List<HistoryRecord> response = new ArrayList<>();
        for (HistoryRecord record : page) {
            response.add(applyFlags(record, query));
        }
        order(response);

        log.debug("Served {} records from {} (start={}, end={}, count={})",
                 response.size(), channel, query.start(), query.end(), query.count());
        return response;
    }

    @Override
    public Map<String, Integer> countMessagesSince(List<String> channelNames, Timetoken since) {
        Map<String, Integer> counts = new ConcurrentHashMap<>();
        for (String channel : channelNames) {
            NavigableMap<Timetoken, HistoryRecord> stored = stored(channel);
            synchronized (stored) {
                int count = stored.tailMap(since, false).size();
                if (count > 0) {
                    counts.put(channel, count);
                }
            }
        }
        log.debug("Counted messages since {} for {}: {}", since, channelNames, counts);
        return counts;
    }

    @Override
    public void deleteRange(String channel, Timetoken start, Timetoken end) {
        HistoryTransportException rejection = deleteRejection;
        if (rejection != null) {
            throw rejection;
        }
        NavigableMap<Timetoken, HistoryRecord> stored = stored(channel);
        int removed;
        synchronized (stored) {
            NavigableMap<Timetoken, HistoryRecord> range = stored.subMap(start, false, end, true);
            removed = range.size();
            range.clear();
        }
        log.info("Deleted {} records in ({}, {}] from {}", removed, start, end, channel);
    }

    /**
     * Stores a record, replacing any record with the same timetoken on that channel.
     */
    public void store(HistoryRecord record) {
        NavigableMap<Timetoken, HistoryRecord> stored = stored(record.getChannel());
        synchronized (stored) {
            stored.put(record.getTimetoken(), record);
        }
    }

    /**
     * Stores {@code count} records with timetokens {@code first, first + step, ...} and payloads
     * {@code {"seq":n}}.
     *
     * @return the stored records, oldest first
     */
    public List<HistoryRecord> seed(String channel, int count, long first, long step) {
        List<HistoryRecord> seeded = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            HistoryRecord record = HistoryRecord.builder()
                .channel(channel)
                .timetoken(Timetoken.of(first + i * step))
                .payload("{\"seq\":" + i + "}")
                .publisher("publisher-" + (i % 3))
                .meta("{\"batch\":" + (i / 100) + "}")
                .recordType("0")
                .build();
            store(record);
            seeded.add(record);
        }
        log.info("Seeded {} records into {}", count, channel);
        return seeded;
    }

    public void setResponseOrder(ResponseOrder responseOrder) {
        this.responseOrder = responseOrder;
    }

    /** Makes every fetch for the channel throw the supplied exception. */
    public void failChannel(String channel, Supplier<? extends RuntimeException> failure) {
        failures.put(channel, failure);
    }

    /** Delays every fetch for the channel. */
    public void delayChannel(String channel, Duration latency) {
        latencies.put(channel, latency);
    }

    /** Makes the channel return its newest page whatever the cursors say. */
    public void ignoreCursors(String channel) {
        cursorIgnoring.put(channel, true);
    }

    /** Makes every delete-range call fail with the given exception, or succeed again with null. */
    public void rejectDeletes(HistoryTransportException rejection) {
        this.deleteRejection = rejection;
    }

    /** Every fetch received, in call order. */
    public List<HistoryQuery> getCalls() {
        return List.copyOf(calls);
    }

    public List<HistoryQuery> getCalls(String channel) {
        return calls.stream().filter(q -> q.channel().equals(channel)).toList();
    }

    public int getStoredCount(String channel) {
        NavigableMap<Timetoken, HistoryRecord> stored = stored(channel);
        synchronized (stored) {
            return stored.size();
        }
    }

    /**
     * Clears all stored data and injected behavior. Useful for testing.
     */
    public void clear() {
        log.info("Clearing all history data");
        channels.clear();
        failures.clear();
        latencies.clear();
        cursorIgnoring.clear();
        calls.clear();
        deleteRejection = null;
    }

    private NavigableMap<Timetoken, HistoryRecord> stored(String channel) {
        return channels.computeIfAbsent(channel, k -> new TreeMap<>());
    }

    private static List<HistoryRecord> page(NavigableMap<Timetoken, HistoryRecord> stored, HistoryQuery query) {
        synchronized (stored) {
            NavigableMap<Timetoken, HistoryRecord> window = stored;
            if (query.start() != null) {
                window = window.tailMap(query.start(), false);
            }
            if (query.end() != null) {
                window = window.headMap(query.end(), true);
            }
            if (query.start() != null) {
                return window.values().stream().limit(query.count()).toList();
            }
            return newest(window, query.count());
        }
    }

    private static List<HistoryRecord> newest(NavigableMap<Timetoken, HistoryRecord> window, int count) {
        synchronized (window) {
            List<HistoryRecord> newestFirst = window.descendingMap().values().stream().limit(count).toList();
            List<HistoryRecord> ascending = new ArrayList<>(newestFirst);
            Collections.reverse(ascending);
            return ascending;
        }
    }

    private static HistoryRecord applyFlags(HistoryRecord record, HistoryQuery query) {
        return record.toBuilder()
            .publisher(query.includePublisher() ? record.getPublisher() : null)
            .meta(query.includeMeta() ? record.getMeta() : null)
            .recordType(query.includeRecordType() ? record.getRecordType() : null)
            .build();
    }

    private void order(List<HistoryRecord> response) {
        switch (responseOrder) {
            case ASCENDING -> { }
            case DESCENDING -> Collections.reverse(response);
            case SHUFFLED -> {
                synchronized (shuffle) {
                    Collections.shuffle(response, shuffle);
                }
            }
        }
    }

    private static void sleep(Duration latency) {
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HistoryTransportException("Interrupted during simulated latency", e);
        }
    }
}
