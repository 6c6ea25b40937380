package com.streamfirst.history.domain;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Wall-clock fields in a named time zone, as entered or displayed at the UI boundary.
 * {@code tickOfSecond} carries the sub-second part in 100 ns ticks; user input leaves it at 0.
 */
public record ZonedCivilTime(
    int year, int month, int day, int hour, int minute, int second, int tickOfSecond, ZoneId zoneId) {

    public ZonedCivilTime {
        Objects.requireNonNull(zoneId, "Zone cannot be null");
        if (tickOfSecond < 0 || tickOfSecond >= Timetoken.TICKS_PER_SECOND) {
            throw new IllegalArgumentException("tickOfSecond out of range: " + tickOfSecond);
        }
        // Rejects impossible calendar fields such as month 13 or February 30
        LocalDateTime.of(year, month, day, hour, minute, second);
    }

    public static ZonedCivilTime of(
        int year, int month, int day, int hour, int minute, int second, ZoneId zoneId) {
        return new ZonedCivilTime(year, month, day, hour, minute, second, 0, zoneId);
    }

    public static ZonedCivilTime of(LocalDateTime dateTime, ZoneId zoneId) {
        return new ZonedCivilTime(
            dateTime.getYear(),
            dateTime.getMonthValue(),
            dateTime.getDayOfMonth(),
            dateTime.getHour(),
            dateTime.getMinute(),
            dateTime.getSecond(),
            (int) (dateTime.getNano() / Timetoken.NANOS_PER_TICK),
            zoneId);
    }

    /** The wall-clock fields without any zone interpretation. */
    public LocalDateTime toLocalDateTime() {
        return LocalDateTime.of(year, month, day, hour, minute, second,
            (int) (tickOfSecond * Timetoken.NANOS_PER_TICK));
    }
}
