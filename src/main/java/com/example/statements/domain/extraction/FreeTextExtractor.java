package com.example.statements.domain.extraction;

import com.example.statements.domain.model.ExtractedField;

import java.util.regex.Pattern;

/**
 * Sanitizes descriptions and notes down to ASCII letters, digits and single spaces.
 * Every run of other characters (punctuation, symbols, line breaks) becomes one space.
 */
public class FreeTextExtractor {

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9]+");

    /**
     * @param text raw text, may be {@code null}
     * @return sanitized text (possibly empty), absent only when the input is {@code null}
     */
    public ExtractedField<String> extract(String text) {
        if (text == null) {
            return ExtractedField.absent();
        }
        return ExtractedField.of(sanitize(text), text);
    }

    public String sanitize(String text) {
        if (text == null) {
            return "";
        }
        return DISALLOWED.matcher(text).replaceAll(" ").strip();
    }
}
