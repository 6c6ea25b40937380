package com.streamfirst.history.domain;

/**
 * Progress snapshot pushed after each batch of a retrieval.
 *
 * @param current records accumulated so far across the whole request
 * @param total target record count across the whole request
 * @param currentChannel channel being fetched
 * @param currentBatch batches completed for that channel, 0 when the channel starts
 * @param totalBatches expected batches for that channel, {@code ceil(targetCount / batchCap)}
 */
public record FetchProgress(
    int current, int total, String currentChannel, int currentBatch, int totalBatches) {

    /** Completed fraction in [0, 1]. */
    public double fraction() {
        return total <= 0 ? 1.0 : Math.min(1.0, (double) current / total);
    }
}
