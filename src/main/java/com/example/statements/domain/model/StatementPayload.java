package com.example.statements.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Wire form of a {@link StatementRecord}: dates as {@code MM/DD/YYYY}, amounts with two decimals.
 */
@JsonPropertyOrder({
        "statement_filename", "account_number", "statement_date", "period_start", "period_end",
        "beginning_balance", "ending_balance", "total_fees", "important_notes", "deposits", "withdrawals"
})
public record StatementPayload(
        @JsonProperty("statement_filename") String statementFilename,
        @JsonProperty("account_number") String accountNumber,
        @JsonProperty("statement_date") String statementDate,
        @JsonProperty("period_start") String periodStart,
        @JsonProperty("period_end") String periodEnd,
        @JsonProperty("beginning_balance") BigDecimal beginningBalance,
        @JsonProperty("ending_balance") BigDecimal endingBalance,
        @JsonProperty("total_fees") BigDecimal totalFees,
        @JsonProperty("important_notes") String importantNotes,
        @JsonProperty("deposits") List<DepositPayload> deposits,
        @JsonProperty("withdrawals") List<WithdrawalPayload> withdrawals
) {

    @JsonPropertyOrder({"date", "description", "amount"})
    public record DepositPayload(
            String date,
            String description,
            BigDecimal amount
    ) {
    }

    @JsonPropertyOrder({"date", "description", "amount", "tax_category"})
    public record WithdrawalPayload(
            String date,
            String description,
            BigDecimal amount,
            @JsonProperty("tax_category") TaxCategory taxCategory
    ) {
    }
}
