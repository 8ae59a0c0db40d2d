package com.policywatch.ingest.resolve;

import java.util.Objects;
import java.util.Optional;

/**
 * A waterfall step's answer: either a value together with the step that produced it, or a miss.
 */
public final class Extracted<T> {

    private static final Extracted<?> MISS = new Extracted<>(null, null);

    private final T value;
    private final String origin;

    private Extracted(T value, String origin) {
        this.value = value;
        this.origin = origin;
    }

    public static <T> Extracted<T> of(T value, String origin) {
        return new Extracted<>(Objects.requireNonNull(value, "value"), origin);
    }

    @SuppressWarnings("unchecked")
    public static <T> Extracted<T> miss() {
        return (Extracted<T>) MISS;
    }

    public boolean isMiss() {
        return value == null;
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    /** Name of the step that produced the value, null on a miss */
    public String origin() {
        return origin;
    }

    @Override
    public String toString() {
        return isMiss() ? "Extracted[miss]" : "Extracted[" + value + " via " + origin + "]";
    }
}
