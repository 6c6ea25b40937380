package com.streamfirst.history.domain;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Failure talking to the upstream history API: network errors, error statuses and timeouts.
 * Retryable in principle; the retrieval engine never retries on its own.
 */
public class HistoryTransportException extends RuntimeException {

    private static final int NO_STATUS = -1;

    private final int statusCode;
    private final String service;
    private final List<String> channels;
    private final boolean timeout;

    public HistoryTransportException(String message) {
        this(message, null);
    }

    public HistoryTransportException(String message, Throwable cause) {
        this(message, cause, NO_STATUS, null, List.of(), false);
    }

    private HistoryTransportException(String message, Throwable cause, int statusCode,
                                      String service, List<String> channels, boolean timeout) {
        super(message, cause);
        this.statusCode = statusCode;
        this.service = service;
        this.channels = channels == null ? List.of() : List.copyOf(channels);
        this.timeout = timeout;
    }

    /**
     * An error status returned by the upstream.
     *
     * @param statusCode HTTP-style status code
     * @param message upstream error message
     * @param service upstream service that rejected the call, if reported
     * @param channels channels named in the rejection, if any
     */
    public static HistoryTransportException status(int statusCode, String message,
                                                   String service, List<String> channels) {
        return new HistoryTransportException(message, null, statusCode, service, channels, false);
    }

    public static HistoryTransportException timedOut(String message, Throwable cause) {
        return new HistoryTransportException(message, cause, NO_STATUS, null, List.of(), true);
    }

    public OptionalInt getStatusCode() {
        return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    public Optional<String> getService() {
        return Optional.ofNullable(service);
    }

    public List<String> getChannels() {
        return channels;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
