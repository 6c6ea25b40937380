package com.streamfirst.history.application;

import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.Timetoken;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges batches into one duplicate-free record list, keyed by timetoken, never holding more
 * than its capacity. Owned by a single session; not thread-safe.
 */
public final class DeduplicatingAccumulator {

  private final int capacity;
  private final Set<Timetoken> seen = new HashSet<>();
  private final List<HistoryRecord> accumulated = new ArrayList<>();

  public DeduplicatingAccumulator(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Adds the records whose timetoken has not been seen yet, in batch order, until full.
   *
   * @return number of records actually added
   */
  public int merge(List<HistoryRecord> batch) {
    int added = 0;
    for (HistoryRecord record : batch) {
      if (accumulated.size() >= capacity) {
        break;
      }
      if (seen.add(record.getTimetoken())) {
        accumulated.add(record);
        added++;
      }
    }
    return added;
  }

  public int size() {
    return accumulated.size();
  }

  public int remaining() {
    return capacity - accumulated.size();
  }

  public boolean contains(Timetoken timetoken) {
    return seen.contains(timetoken);
  }

  /** Accumulated records sorted by timetoken ascending. */
  public List<HistoryRecord> sortedRecords() {
    List<HistoryRecord> copy = new ArrayList<>(accumulated);
    copy.sort(Comparator.comparing(HistoryRecord::getTimetoken));
    return List.copyOf(copy);
  }
}
