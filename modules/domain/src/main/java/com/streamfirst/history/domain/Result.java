package com.streamfirst.history.domain;

import lombok.EqualsAndHashCode;

import java.util.Optional;

/**
 * Outcome of an upstream mutation such as a history delete. A failure carries a readable
 * message and a code callers can switch on; for deletions the code is a {@link DeleteRejection}
 * name.
 *
 * @param <T> value produced on success, {@link Void} for deletions
 */
@EqualsAndHashCode
public final class Result<T> {

    private final boolean success;
    private final String errorMessage;
    private final String errorCode;

    private Result(boolean success, String errorMessage, String errorCode) {
        this.success = success;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
    }

    public static Result<Void> success() {
        return new Result<>(true, null, null);
    }

    /**
     * @param errorMessage shown to whoever asked for the operation
     * @param errorCode stable identifier of the failure class
     */
    public static <T> Result<T> failure(String errorMessage, String errorCode) {
        return new Result<>(false, errorMessage, errorCode);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    public Optional<String> getErrorCode() {
        return success ? Optional.empty() : Optional.ofNullable(errorCode);
    }

    @Override
    public String toString() {
        return success ? "Result.success" : "Result.failure(" + errorCode + ": " + errorMessage + ")";
    }
}
