package com.z254.butterfly.sentinel.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Value-or-error holder for outcomes that are expected and frequent, such as a series that is
 * still too short to forecast.
 *
 * @param <T> value type
 */
public final class Result<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;

    private Result(T value, ErrorKind errorKind, String message) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> Result<T> error(ErrorKind kind, String message) {
        return new Result<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public static <T> Result<T> insufficientData(String message) {
        return error(ErrorKind.INSUFFICIENT_DATA, message);
    }

    public static <T> Result<T> modelUnavailable(String message) {
        return error(ErrorKind.MODEL_UNAVAILABLE, message);
    }

    public boolean isOk() {
        return errorKind == null;
    }

    public boolean is(ErrorKind kind) {
        return errorKind == kind;
    }

    /**
     * @throws IllegalStateException when this result carries an error
     */
    public T getValue() {
        if (!isOk()) {
            throw new IllegalStateException("No value: " + errorKind + " (" + message + ")");
        }
        return value;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public Result<T> orElseGet(Supplier<Result<T>> fallback) {
        return isOk() ? this : fallback.get();
    }

    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) {
            return new Result<>(null, errorKind, message);
        }
        return Result.ok(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isOk() ? "Result[ok=" + value + "]" : "Result[" + errorKind + ": " + message + "]";
    }
}
