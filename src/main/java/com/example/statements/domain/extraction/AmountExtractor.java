package com.example.statements.domain.extraction;

import com.example.statements.domain.model.ExtractedField;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes monetary amounts.
 * Currency symbols, thousands separators and whitespace are stripped; what remains must be a non-negative
 * decimal with at most two fractional digits. The result always carries a scale of two. Negative
 * ({@code -12.00}, {@code (12.00)}) or over-precise values are rejected rather than coerced.
 */
public class AmountExtractor {

    private static final int SCALE = 2;
    private static final Pattern AMOUNT_TOKEN = Pattern.compile("[-(]?\\$?\\s?[-(]?\\d[\\d,]*(?:\\.\\d+)?\\)?");
    private static final Pattern PLAIN_AMOUNT = Pattern.compile("\\d+(?:\\.\\d{1,2})?");

    /**
     * Finds the amount on a labeled line such as {@code Ending Balance $13,571.27}.
     * The last token with a decimal point wins; without one, the last numeric token is used.
     *
     * @param text line or line fragment
     * @return parsed amount, absent when the text holds no numeric token
     */
    public ExtractedField<BigDecimal> extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractedField.absent();
        }
        List<String> tokens = new ArrayList<>();
        Matcher matcher = AMOUNT_TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        if (tokens.isEmpty()) {
            return ExtractedField.absent();
        }
        String chosen = tokens.get(tokens.size() - 1);
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).contains(".")) {
                chosen = tokens.get(i);
                break;
            }
        }
        return parse(chosen);
    }

    /**
     * Parses one amount token.
     *
     * @param token raw token, e.g. {@code $1,428.73}
     * @return amount with scale two, or a rejected field for negative/unparsable input
     */
    public ExtractedField<BigDecimal> parse(String token) {
        if (token == null || token.isBlank()) {
            return ExtractedField.absent();
        }
        String raw = token.strip();
        String cleaned = raw.replace("$", "").replace(",", "").replaceAll("\\s+", "");
        if (!PLAIN_AMOUNT.matcher(cleaned).matches()) {
            return ExtractedField.rejected(raw);
        }
        return ExtractedField.of(new BigDecimal(cleaned).setScale(SCALE), raw);
    }
}
