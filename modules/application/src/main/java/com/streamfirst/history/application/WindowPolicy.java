package com.streamfirst.history.application;

import com.streamfirst.history.domain.HistoryRecord;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.domain.WindowBound;
import com.streamfirst.history.domain.WindowMode;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides, batch by batch, how the pagination cursors move.
 *
 * <p>The mode is chosen once from the caller's bounds and never re-derived. Each step narrows
 * the unexplored side of the window toward data already seen:
 *
 * <ul>
 *   <li>{@link WindowMode#UNBOUNDED} and {@link WindowMode#END_ONLY}: {@code end <- oldest - 1}
 *   <li>{@link WindowMode#START_ONLY}: {@code start <- newest + 1}
 *   <li>{@link WindowMode#BOUNDED}: {@code start <- newest + 1}, complete once that reaches
 *       {@code end}
 * </ul>
 */
@Slf4j
public final class WindowPolicy {

  /** Outcome of advancing past a batch. */
  public enum Step {
    CONTINUE,
    /** No part of the window is left to explore */
    COMPLETE
  }

  private final WindowMode mode;
  private Timetoken start;
  private Timetoken end;

  private WindowPolicy(WindowMode mode, Timetoken start, Timetoken end) {
    this.mode = mode;
    this.start = start;
    this.end = end;
  }

  /** Starts a policy for the caller's window; cursors begin at the caller's bounds. */
  public static WindowPolicy forWindow(WindowBound window) {
    return new WindowPolicy(window.mode(), window.start(), window.end());
  }

  public WindowMode mode() {
    return mode;
  }

  /** Exclusive lower cursor for the next call, or null. */
  public Timetoken startCursor() {
    return start;
  }

  /** Inclusive upper cursor for the next call, or null. */
  public Timetoken endCursor() {
    return end;
  }

  /**
   * Moves the cursor past a batch.
   *
   * @param ascendingBatch the records just fetched, sorted ascending, not empty
   */
  public Step advance(List<HistoryRecord> ascendingBatch) {
    if (ascendingBatch.isEmpty()) {
      throw new IllegalArgumentException("Cannot advance past an empty batch");
    }
    Timetoken oldest = ascendingBatch.get(0).getTimetoken();
    Timetoken newest = ascendingBatch.get(ascendingBatch.size() - 1).getTimetoken();

    return switch (mode) {
      case UNBOUNDED, END_ONLY -> walkBackward(oldest);
      case START_ONLY -> walkForward(newest);
      case BOUNDED -> walkForwardWithin(newest);
    };
  }

  private Step walkBackward(Timetoken oldest) {
    if (oldest.value() == 0) {
      return Step.COMPLETE;
    }
    end = oldest.previous();
    log.debug("{}: end moved to {}", mode, end);
    return Step.CONTINUE;
  }

  private Step walkForward(Timetoken newest) {
    start = newest.next();
    log.debug("{}: start moved to {}", mode, start);
    return Step.CONTINUE;
  }

  private Step walkForwardWithin(Timetoken newest) {
    Timetoken nextStart = newest.next();
    if (nextStart.compareTo(end) >= 0) {
      log.debug("{}: next start {} reached end {}, window complete", mode, nextStart, end);
      return Step.COMPLETE;
    }
    start = nextStart;
    log.debug("{}: start moved to {}", mode, start);
    return Step.CONTINUE;
  }
}
