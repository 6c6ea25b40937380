package com.streamfirst.history.application;

import com.streamfirst.history.domain.ChannelResult;
import com.streamfirst.history.domain.HistoryRecord;
import java.util.List;
import java.util.Locale;

/** Case-insensitive text filter over retrieved history. */
public final class HistorySearch {

  private HistorySearch() {}

  /**
   * Keeps the records whose payload, publisher or meta contains {@code term}. Channel entries
   * stay in place even when emptied; a blank term returns the input unchanged.
   */
  public static List<ChannelResult> filter(List<ChannelResult> results, String term) {
    if (term == null || term.isBlank()) {
      return results;
    }
    String needle = term.toLowerCase(Locale.ROOT);
    return results.stream()
        .map(result -> result.withRecords(
            result.records().stream().filter(r -> matches(r, needle)).toList()))
        .toList();
  }

  /** Total record count across results. */
  public static int countRecords(List<ChannelResult> results) {
    return results.stream().mapToInt(ChannelResult::totalMessages).sum();
  }

  private static boolean matches(HistoryRecord record, String needle) {
    return contains(record.getPayload(), needle)
        || contains(record.getPublisher(), needle)
        || contains(record.getMeta(), needle);
  }

  private static boolean contains(String haystack, String needle) {
    return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
  }
}
