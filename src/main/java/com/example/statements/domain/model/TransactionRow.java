package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Candidate transaction read from a statement section, before validation.
 *
 * @param section     section the row belongs to
 * @param lineNumber  1-based line number inside the statement text
 * @param date        booking date
 * @param description sanitized description
 * @param amount      non-negative amount
 * @param taxCategory category assigned by the classifier, {@code null} for deposits and unclassified rows
 */
public record TransactionRow(
        TransactionSection section,
        int lineNumber,
        ExtractedField<LocalDate> date,
        ExtractedField<String> description,
        ExtractedField<BigDecimal> amount,
        TaxCategory taxCategory
) {

    public TransactionRow withTaxCategory(TaxCategory category) {
        return new TransactionRow(section, lineNumber, date, description, amount, category);
    }

    public boolean hasDescription() {
        return description.present() && !description.value().isBlank();
    }

    /**
     * @return {@code true} when the row carries everything its output entry needs
     */
    public boolean isWellFormed() {
        if (!date.present() || !amount.present() || !hasDescription()) {
            return false;
        }
        return section == TransactionSection.DEPOSITS || taxCategory != null;
    }
}
