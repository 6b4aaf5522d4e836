package com.example.statements.domain.extraction;

import com.example.statements.domain.model.ExtractedField;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes calendar dates in statement text.
 * Numeric {@code MM/DD/YYYY} tokens are the primary format; the long form printed on period banners
 * ({@code January 31, 2023}) is accepted as well. Impossible dates are reported as absent, never clamped.
 */
public class DateExtractor {

    public static final DateTimeFormatter OUTPUT_FORMATTER = DateTimeFormatter.ofPattern("MM/dd/uuuu");

    private static final DateTimeFormatter STRICT_FORMATTER =
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern NUMERIC_DATE = Pattern.compile("(?<![\\d/])(\\d{2}/\\d{2}/\\d{4})(?![\\d/])");
    private static final Pattern LONG_DATE = Pattern.compile(
            "\\b(January|February|March|April|May|June|July|August|September|October|November|December)"
                    + "\\s+(\\d{1,2}),?\\s+(\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY = Pattern.compile("(\\d{2})/(\\d{2})");
    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("january", 1), Map.entry("february", 2), Map.entry("march", 3),
            Map.entry("april", 4), Map.entry("may", 5), Map.entry("june", 6),
            Map.entry("july", 7), Map.entry("august", 8), Map.entry("september", 9),
            Map.entry("october", 10), Map.entry("november", 11), Map.entry("december", 12)
    );

    /**
     * Returns the first date token found in the text.
     *
     * @param text text to scan, may be {@code null}
     * @return first date, absent when no token exists, rejected when the first token is not a real date
     */
    public ExtractedField<LocalDate> extract(String text) {
        List<ExtractedField<LocalDate>> all = extractAll(text);
        return all.isEmpty() ? ExtractedField.absent() : all.get(0);
    }

    /**
     * Returns every date token in reading order, including tokens that failed calendar validation.
     *
     * @param text text to scan, may be {@code null}
     * @return date fields ordered by position
     */
    public List<ExtractedField<LocalDate>> extractAll(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<PositionedDate> found = new ArrayList<>();
        Matcher numeric = NUMERIC_DATE.matcher(text);
        while (numeric.find()) {
            found.add(new PositionedDate(numeric.start(), parseToken(numeric.group(1))));
        }
        Matcher longForm = LONG_DATE.matcher(text);
        while (longForm.find()) {
            found.add(new PositionedDate(longForm.start(), parseLongForm(longForm)));
        }
        found.sort(Comparator.comparingInt(PositionedDate::start));
        return found.stream().map(PositionedDate::field).toList();
    }

    /**
     * Parses a complete {@code MM/DD/YYYY} token.
     *
     * @param token candidate token
     * @return parsed date or a rejected field for out-of-range values
     */
    public ExtractedField<LocalDate> parseToken(String token) {
        if (token == null || token.isBlank()) {
            return ExtractedField.absent();
        }
        String trimmed = token.strip();
        try {
            return ExtractedField.of(LocalDate.parse(trimmed, STRICT_FORMATTER), trimmed);
        } catch (DateTimeParseException ex) {
            return ExtractedField.rejected(trimmed);
        }
    }

    /**
     * Resolves a {@code MM/DD} row date that was printed without a year.
     * The period-end year is tried first, then the period-start year; the first candidate inside the period wins.
     * When no candidate lands inside the period the first valid candidate is used.
     *
     * @param token         {@code MM/DD} token
     * @param periodStart   statement period start, may be {@code null}
     * @param periodEnd     statement period end, may be {@code null}
     * @param statementDate statement date, used when the period is unknown; may be {@code null}
     * @return resolved date or absent/rejected field
     */
    public ExtractedField<LocalDate> resolveMonthDay(String token, LocalDate periodStart, LocalDate periodEnd,
                                                     LocalDate statementDate) {
        if (token == null) {
            return ExtractedField.absent();
        }
        String trimmed = token.strip();
        Matcher matcher = MONTH_DAY.matcher(trimmed);
        if (!matcher.matches()) {
            return ExtractedField.rejected(trimmed);
        }
        int month = Integer.parseInt(matcher.group(1));
        int day = Integer.parseInt(matcher.group(2));

        List<Integer> years = new ArrayList<>();
        addYear(years, periodEnd);
        addYear(years, periodStart);
        addYear(years, statementDate);

        LocalDate fallback = null;
        for (int year : years) {
            LocalDate candidate = safeDate(year, month, day);
            if (candidate == null) {
                continue;
            }
            if (periodStart != null && periodEnd != null
                    && !candidate.isBefore(periodStart) && !candidate.isAfter(periodEnd)) {
                return ExtractedField.of(candidate, trimmed);
            }
            if (fallback == null) {
                fallback = candidate;
            }
        }
        return fallback != null ? ExtractedField.of(fallback, trimmed) : ExtractedField.rejected(trimmed);
    }

    /**
     * Formats a date the way the output payload expects it.
     *
     * @param date date to format
     * @return {@code MM/DD/YYYY} string
     */
    public static String format(LocalDate date) {
        return date == null ? null : OUTPUT_FORMATTER.format(date);
    }

    private ExtractedField<LocalDate> parseLongForm(Matcher matcher) {
        String raw = matcher.group();
        Integer month = MONTHS.get(matcher.group(1).toLowerCase(Locale.ROOT));
        LocalDate date = safeDate(Integer.parseInt(matcher.group(3)), month, Integer.parseInt(matcher.group(2)));
        return date == null ? ExtractedField.rejected(raw) : ExtractedField.of(date, raw);
    }

    private static void addYear(List<Integer> years, LocalDate date) {
        if (date != null && !years.contains(date.getYear())) {
            years.add(date.getYear());
        }
    }

    private static LocalDate safeDate(int year, int month, int day) {
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException ex) {
            return null;
        }
    }

    private record PositionedDate(int start, ExtractedField<LocalDate> field) {
    }
}
