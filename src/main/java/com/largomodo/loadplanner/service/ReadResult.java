package com.largomodo.loadplanner.service;

import java.util.List;

/**
 * Value read from an input source together with the non-fatal problems met
 * while reading it.
 * <p>
 * A degraded result still carries a usable value (an empty catalog, the valid
 * subset of a container file); the warnings tell the caller what was dropped.
 *
 * @param value    the value, never null
 * @param warnings human-readable warnings (unmodifiable, empty when clean)
 * @param <T>      value type
 */
public record ReadResult<T>(T value, List<String> warnings) {

    public ReadResult {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static <T> ReadResult<T> ok(T value) {
        return new ReadResult<>(value, List.of());
    }

    public static <T> ReadResult<T> degraded(T value, String warning) {
        return new ReadResult<>(value, List.of(warning));
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
