package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the field extractors found in one statement text. No field is guaranteed to be present.
 */
public record ExtractedStatement(
        ExtractedField<String> accountNumber,
        String companyHint,
        ExtractedField<LocalDate> statementDate,
        ExtractedField<LocalDate> periodStart,
        ExtractedField<LocalDate> periodEnd,
        ExtractedField<BigDecimal> beginningBalance,
        ExtractedField<BigDecimal> endingBalance,
        ExtractedField<BigDecimal> totalFees,
        ExtractedField<String> importantNotes,
        List<TransactionRow> transactions
) {
    public ExtractedStatement {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public ExtractedStatement withTransactions(List<TransactionRow> rows) {
        return new ExtractedStatement(accountNumber, companyHint, statementDate, periodStart, periodEnd,
                beginningBalance, endingBalance, totalFees, importantNotes, rows);
    }
}
