package com.streamfirst.canvas.sync.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Generic result type that represents either success with data or failure with an error kind.
 * Sync operations never throw for backend, channel or payload problems; they report them here so
 * callers can decide whether to retry, surface the problem or keep working locally.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    SyncErrorKind errorKind;
    String errorMessage;

    private Result(boolean success, T data, SyncErrorKind errorKind, String errorMessage) {
        this.success = success;
        this.data = data;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, null);
    }

    /**
     * Creates a successful result without data (for void operations).
     */
    public static Result<Void> success() {
        return new Result<>(true, null, null, null);
    }

    /**
     * Creates a failure result with an error kind and message.
     */
    public static <T> Result<T> failure(@NonNull SyncErrorKind errorKind, String errorMessage) {
        return new Result<>(false, null, errorKind, errorMessage);
    }

    /**
     * Returns the data if successful, or throws an exception if failed.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new IllegalStateException(errorMessage + " (kind: " + errorKind + ")");
    }

    /**
     * Returns the data if successful, or the provided default value if failed.
     */
    public T orElse(T defaultValue) {
        return success ? data : defaultValue;
    }

    public T orElseGet(Supplier<T> supplier) {
        return success ? data : supplier.get();
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return Result.failure(errorKind, errorMessage);
    }

    /**
     * Flat maps the data to another Result if successful, preserves failure if failed.
     */
    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        if (success) {
            return mapper.apply(data);
        }
        return Result.failure(errorKind, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Returns true if this result failed with the given kind.
     */
    public boolean failedWith(SyncErrorKind kind) {
        return !success && errorKind == kind;
    }

    /**
     * Gets the data if successful, empty otherwise. Void results are always empty.
     */
    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    public Optional<SyncErrorKind> getErrorKind() {
        return Optional.ofNullable(errorKind);
    }

    /**
     * Gets the error message if failed, empty otherwise.
     */
    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorKind + ", " + errorMessage + ")";
    }
}
