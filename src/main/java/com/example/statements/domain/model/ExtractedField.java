package com.example.statements.domain.model;

/**
 * Result of a single recognizer run over statement text.
 * Extractors never throw: a missing or malformed value is reported as an absent field, optionally
 * keeping the raw span that was looked at so the validator can tell "not found" from "found but invalid".
 *
 * @param present whether a usable value was recognized
 * @param value   recognized value or {@code null} when absent
 * @param rawSpan text the value was read from, or {@code null} when nothing matched
 * @param <T>     value type
 */
public record ExtractedField<T>(
        boolean present,
        T value,
        String rawSpan
) {

    /**
     * Creates a present field.
     *
     * @param value   recognized value, never {@code null}
     * @param rawSpan source text of the value
     * @param <T>     value type
     * @return present field
     */
    public static <T> ExtractedField<T> of(T value, String rawSpan) {
        if (value == null) {
            return new ExtractedField<>(false, null, rawSpan);
        }
        return new ExtractedField<>(true, value, rawSpan);
    }

    /**
     * @param <T> value type
     * @return field for which nothing matched at all
     */
    public static <T> ExtractedField<T> absent() {
        return new ExtractedField<>(false, null, null);
    }

    /**
     * Creates an absent field that remembers the text which failed to parse.
     *
     * @param rawSpan offending text
     * @param <T>     value type
     * @return absent field carrying the raw span
     */
    public static <T> ExtractedField<T> rejected(String rawSpan) {
        return new ExtractedField<>(false, null, rawSpan);
    }

    public boolean isAbsent() {
        return !present;
    }

    /**
     * @return {@code true} when a span was found but could not be turned into a value
     */
    public boolean isRejected() {
        return !present && rawSpan != null;
    }

    public T orElse(T fallback) {
        return present ? value : fallback;
    }
}
