package com.largomodo.loadplanner.util;

/**
 * Outcome of validating one piece of user input: a value or an error message.
 *
 * @param value parsed value, null on failure
 * @param error message to show the user, null on success
 * @param <T>   value type
 */
public record ParseResult<T>(T value, String error) {

    public static <T> ParseResult<T> ok(T value) {
        return new ParseResult<>(value, null);
    }

    public static <T> ParseResult<T> failure(String error) {
        return new ParseResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }
}
