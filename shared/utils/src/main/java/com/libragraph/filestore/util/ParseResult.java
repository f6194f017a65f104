package com.libragraph.filestore.util;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of decoding untrusted input: either a value or a reason it was rejected.
 * Decoders return this instead of throwing past the boundary.
 */
public final class ParseResult<T> {

    private final T value;
    private final String error;

    private ParseResult(T value, String error) {
        this.value = value;
        this.error = error;
    }

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ParseResult<T> err(String reason) {
        return new ParseResult<>(null, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this result is an error
     */
    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("No value: " + error);
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this result holds a value
     */
    public String error() {
        if (isOk()) {
            throw new IllegalStateException("Result is ok");
        }
        return error;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public <R> ParseResult<R> map(Function<? super T, ? extends R> fn) {
        return isOk() ? ok(fn.apply(value)) : err(error);
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
