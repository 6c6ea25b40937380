package com.streamfirst.history.application;

import com.streamfirst.history.domain.DeleteRejection;
import com.streamfirst.history.domain.HistoryTransportException;
import com.streamfirst.history.domain.Result;
import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.ports.HistoryPort;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Deletes messages from channel history. Upstream rejections come back as failed {@link Result}s
 * whose error code is a {@link DeleteRejection} name.
 */
@Slf4j
@RequiredArgsConstructor
public class MessageDeletionCoordinator {

  private final HistoryPort historyPort;

  /**
   * Deletes the single message published at {@code timetoken}, using the range
   * {@code (timetoken - 1, timetoken]}.
   */
  public Result<Void> deleteMessage(String channel, Timetoken timetoken) {
    if (timetoken.value() == 0) {
      return Result.failure("Timetoken 0 cannot address a message", DeleteRejection.MALFORMED_RANGE.name());
    }
    return deleteRange(channel, timetoken.previous(), timetoken);
  }

  /** Deletes every message in {@code (start, end]}. */
  public Result<Void> deleteRange(String channel, Timetoken start, Timetoken end) {
    if (channel == null || channel.isBlank()) {
      return Result.failure("Channel is required", DeleteRejection.MALFORMED_RANGE.name());
    }
    if (!start.isBefore(end)) {
      return Result.failure(
          "Range start " + start + " must be before end " + end, DeleteRejection.MALFORMED_RANGE.name());
    }

    try {
      historyPort.deleteRange(channel, start, end);
      log.info("Deleted messages in ({}, {}] from {}", start, end, channel);
      return Result.success();
    } catch (HistoryTransportException e) {
      DeleteRejection rejection = DeleteRejection.classify(e);
      log.warn("Delete of ({}, {}] on {} rejected as {}: {}", start, end, channel, rejection, e.getMessage());
      return Result.failure(describe(rejection, e), rejection.name());
    }
  }

  /** The rejection carried by a failed deletion result, if any. */
  public static Optional<DeleteRejection> rejectionOf(Result<?> result) {
    return result.getErrorCode().map(DeleteRejection::valueOf);
  }

  private static String describe(DeleteRejection rejection, HistoryTransportException e) {
    return switch (rejection) {
      case FEATURE_NOT_ENABLED -> "Delete-From-History is not enabled for this key set";
      case ACCESS_DENIED -> e.getChannels().isEmpty()
          ? "Access denied"
          : "Access denied for channel(s): " + String.join(", ", e.getChannels());
      case NOT_FOUND -> "Message not found or already deleted";
      case UPSTREAM_UNAVAILABLE -> "History service is temporarily unavailable";
      case PERMISSION_DENIED, MALFORMED_RANGE, GENERIC ->
          e.getMessage() == null ? rejection.name() : e.getMessage();
    };
  }
}
