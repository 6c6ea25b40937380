package com.streamfirst.history.domain;

import java.util.Locale;

/**
 * Reasons the upstream refuses a delete-range call. Carried as the error code of a failed
 * deletion {@link Result}.
 */
public enum DeleteRejection {
    /** Delete-from-history is not enabled on the key set */
    FEATURE_NOT_ENABLED,
    /** Access Manager denied the operation */
    ACCESS_DENIED,
    /** Any other 403 */
    PERMISSION_DENIED,
    /** The range or timetoken was rejected as invalid */
    MALFORMED_RANGE,
    /** Nothing to delete at that timetoken */
    NOT_FOUND,
    /** Upstream 5xx */
    UPSTREAM_UNAVAILABLE,
    GENERIC;

    /**
     * Maps an upstream failure to a rejection reason.
     */
    public static DeleteRejection classify(HistoryTransportException failure) {
        if (failure.getStatusCode().isEmpty()) {
            return GENERIC;
        }
        int status = failure.getStatusCode().getAsInt();
        String message = failure.getMessage() == null ? "" : failure.getMessage();
        if (status == 403) {
            if (message.contains("history Delete API") || message.contains("Storage Delete")) {
                return FEATURE_NOT_ENABLED;
            }
            boolean accessManager = failure.getService()
                .map(s -> s.toLowerCase(Locale.ROOT).equals("access manager"))
                .orElse(false);
            if (accessManager || message.contains("Forbidden")) {
                return ACCESS_DENIED;
            }
            return PERMISSION_DENIED;
        }
        if (status == 400) {
            return MALFORMED_RANGE;
        }
        if (status == 404) {
            return NOT_FOUND;
        }
        if (status >= 500) {
            return UPSTREAM_UNAVAILABLE;
        }
        return GENERIC;
    }
}
