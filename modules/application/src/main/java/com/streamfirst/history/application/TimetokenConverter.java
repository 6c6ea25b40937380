package com.streamfirst.history.application;

import com.streamfirst.history.domain.Timetoken;
import com.streamfirst.history.domain.ZonedCivilTime;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Converts between timetokens and wall-clock time in a named zone.
 *
 * <p>{@link #fromCivil} applies a single offset correction: it reads the civil fields as if they
 * were UTC, renders that instant in the target zone, and shifts the guess once by the difference.
 * That is exact away from offset transitions. Within an offset-width of a transition, and for
 * wall-clock times that fall in a gap or an overlap, the result can be off by the transition's
 * offset change.
 */
public final class TimetokenConverter {

  /** Zones offered by default in zone pickers. */
  public static final List<String> COMMON_ZONES =
      List.of(
          "UTC",
          "America/New_York",
          "America/Chicago",
          "America/Denver",
          "America/Los_Angeles",
          "America/Toronto",
          "America/Vancouver",
          "Europe/London",
          "Europe/Paris",
          "Europe/Berlin",
          "Europe/Madrid",
          "Europe/Rome",
          "Asia/Tokyo",
          "Asia/Shanghai",
          "Asia/Kolkata",
          "Asia/Dubai",
          "Australia/Sydney",
          "Australia/Melbourne",
          "Pacific/Auckland");

  private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

  private TimetokenConverter() {}

  /** Wall-clock fields of a timetoken in the given zone. */
  public static ZonedCivilTime toCivil(Timetoken timetoken, ZoneId zoneId) {
    ZonedDateTime zoned = timetoken.toInstant().atZone(zoneId);
    return ZonedCivilTime.of(zoned.toLocalDateTime(), zoneId);
  }

  /** Timetoken for wall-clock fields in their zone, using the single-pass correction. */
  public static Timetoken fromCivil(ZonedCivilTime civil) {
    LocalDateTime requested = civil.toLocalDateTime().withNano(0);
    long firstGuess = requested.toEpochSecond(ZoneOffset.UTC);

    LocalDateTime rendered = LocalDateTime.ofInstant(Instant.ofEpochSecond(firstGuess), civil.zoneId());
    long delta = firstGuess - rendered.toEpochSecond(ZoneOffset.UTC);

    long seconds = firstGuess + delta;
    return Timetoken.of(
        Math.addExact(Math.multiplyExact(seconds, Timetoken.TICKS_PER_SECOND), civil.tickOfSecond()));
  }

  /** Milliseconds since the epoch, as used by display code. */
  public static long toEpochMillis(Timetoken timetoken) {
    return timetoken.toEpochMillis();
  }

  /** Renders a timetoken as {@code yyyy-MM-dd'T'HH:mm:ss} in the given zone. */
  public static String format(Timetoken timetoken, ZoneId zoneId) {
    return DISPLAY.format(toCivil(timetoken, zoneId).toLocalDateTime());
  }

  /**
   * Parses user input of the form {@code yyyy-MM-dd'T'HH:mm} or {@code yyyy-MM-dd'T'HH:mm:ss}.
   *
   * @throws IllegalArgumentException if the text is not a local date-time
   */
  public static ZonedCivilTime parseCivil(String text, ZoneId zoneId) {
    try {
      return ZonedCivilTime.of(LocalDateTime.parse(text.trim()).withNano(0), zoneId);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Not a local date-time: " + text, e);
    }
  }

  /** Parses user input and converts it to a timetoken. */
  public static Timetoken parseToTimetoken(String text, ZoneId zoneId) {
    return fromCivil(parseCivil(text, zoneId));
  }
}
