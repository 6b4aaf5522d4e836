package com.example.statements.domain.extraction;

import com.example.statements.domain.model.ExtractedField;

import java.util.regex.Pattern;

/**
 * Reduces a source path to its file name and checks it names a PDF.
 */
public class FilenameExtractor {

    private static final Pattern PDF_NAME = Pattern.compile("^[^/]+\\.pdf$");

    /**
     * @param sourceFilename path or name the statement text came from
     * @return the part after the last {@code /} or {@code \}, rejected unless it ends in {@code .pdf}
     */
    public ExtractedField<String> extract(String sourceFilename) {
        if (sourceFilename == null || sourceFilename.isBlank()) {
            return ExtractedField.absent();
        }
        String trimmed = sourceFilename.strip();
        int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        String name = trimmed.substring(separator + 1);
        if (!PDF_NAME.matcher(name).matches()) {
            return ExtractedField.rejected(name);
        }
        return ExtractedField.of(name, trimmed);
    }
}
