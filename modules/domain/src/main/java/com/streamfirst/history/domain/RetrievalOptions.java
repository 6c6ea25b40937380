package com.streamfirst.history.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Tuning and fetch flags for a retrieval. Defaults match the upstream's limits:
 * at most 100 records per call, a 100 ms courtesy pause between calls and one channel at a time.
 */
@Value
public class RetrievalOptions {

    /** Hard upstream limit on records per call */
    public static final int MAX_BATCH_CAP = 100;

    /** Upper bound on concurrently processed channels */
    public static final int MAX_CONCURRENT_CHANNELS = 8;

    /** Records requested per upstream call */
    int batchCap;

    /** Extra iterations tolerated beyond {@code ceil(targetCount / batchCap)} */
    int safetySlack;

    /** Pause between consecutive calls for one channel */
    @NonNull Duration interBatchDelay;

    /** Per-call upstream timeout; zero disables it */
    @NonNull Duration requestTimeout;

    /** Channels fetched in parallel; 1 keeps the sequential behavior */
    int maxConcurrentChannels;

    boolean includeMeta;

    boolean includePublisher;

    boolean includeRecordType;

    /** Upstream only accepts this flag for single-channel reads */
    boolean includeMessageActions;

    @Builder(toBuilder = true)
    private RetrievalOptions(int batchCap, int safetySlack, Duration interBatchDelay,
                             Duration requestTimeout, int maxConcurrentChannels,
                             boolean includeMeta, boolean includePublisher,
                             boolean includeRecordType, boolean includeMessageActions) {
        if (batchCap < 1 || batchCap > MAX_BATCH_CAP) {
            throw new IllegalArgumentException(
                "batchCap must be between 1 and " + MAX_BATCH_CAP + ": " + batchCap);
        }
        if (safetySlack < 0) {
            throw new IllegalArgumentException("safetySlack cannot be negative: " + safetySlack);
        }
        if (interBatchDelay == null || interBatchDelay.isNegative()) {
            throw new IllegalArgumentException("interBatchDelay must be zero or positive");
        }
        if (requestTimeout == null || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be zero or positive");
        }
        if (maxConcurrentChannels < 1 || maxConcurrentChannels > MAX_CONCURRENT_CHANNELS) {
            throw new IllegalArgumentException("maxConcurrentChannels must be between 1 and "
                + MAX_CONCURRENT_CHANNELS + ": " + maxConcurrentChannels);
        }
        this.batchCap = batchCap;
        this.safetySlack = safetySlack;
        this.interBatchDelay = interBatchDelay;
        this.requestTimeout = requestTimeout;
        this.maxConcurrentChannels = maxConcurrentChannels;
        this.includeMeta = includeMeta;
        this.includePublisher = includePublisher;
        this.includeRecordType = includeRecordType;
        this.includeMessageActions = includeMessageActions;
    }

    /** Builder pre-populated with the defaults. */
    public static class RetrievalOptionsBuilder {
        private int batchCap = MAX_BATCH_CAP;
        private int safetySlack = 2;
        private Duration interBatchDelay = Duration.ofMillis(100);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private int maxConcurrentChannels = 1;
        private boolean includeMeta = false;
        private boolean includePublisher = true;
        private boolean includeRecordType = true;
        private boolean includeMessageActions = false;
    }

    public static RetrievalOptions defaults() {
        return builder().build();
    }

    /** Number of batches a channel needs at full batch size. */
    public int expectedBatches(int targetCount) {
        return (targetCount + batchCap - 1) / batchCap;
    }

    /** Iteration ceiling for one channel session. */
    public int iterationCap(int targetCount) {
        return expectedBatches(targetCount) + safetySlack;
    }
}
