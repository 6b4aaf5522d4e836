package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Fully validated statement. Only {@code RecordValidator} creates instances, after every validation step passed,
 * so the period invariants ({@code periodStart <= statementDate <= periodEnd}) always hold.
 */
public record StatementRecord(
        String filename,
        AccountReference account,
        LocalDate statementDate,
        LocalDate periodStart,
        LocalDate periodEnd,
        BigDecimal beginningBalance,
        BigDecimal endingBalance,
        BigDecimal totalFees,
        String importantNotes,
        List<Deposit> deposits,
        List<Withdrawal> withdrawals
) {
    public StatementRecord {
        deposits = deposits == null ? List.of() : List.copyOf(deposits);
        withdrawals = withdrawals == null ? List.of() : List.copyOf(withdrawals);
        importantNotes = importantNotes == null ? "" : importantNotes;
    }
}
