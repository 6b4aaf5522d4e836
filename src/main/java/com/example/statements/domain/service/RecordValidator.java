package com.example.statements.domain.service;

import com.example.statements.domain.exception.StatementRejectedException;
import com.example.statements.domain.model.AccountReference;
import com.example.statements.domain.model.Deposit;
import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ExtractedField;
import com.example.statements.domain.model.ExtractedStatement;
import com.example.statements.domain.model.MalformedTransactionPolicy;
import com.example.statements.domain.model.StatementRecord;
import com.example.statements.domain.model.TransactionRow;
import com.example.statements.domain.model.TransactionSection;
import com.example.statements.domain.model.ValidationStep;
import com.example.statements.domain.model.Withdrawal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns extracted candidates into a {@link StatementRecord}, or rejects the statement.
 * Steps run in the configured order and stop at the first violation, which decides the reported error code.
 */
public class RecordValidator {

    private static final Logger log = LoggerFactory.getLogger(RecordValidator.class);

    private final List<ValidationStep> order;
    private final MalformedTransactionPolicy malformedTransactionPolicy;

    public RecordValidator() {
        this(ValidationStep.defaultOrder(), MalformedTransactionPolicy.SKIP);
    }

    /**
     * @param order                      every validation step exactly once
     * @param malformedTransactionPolicy handling of rows that miss a date, description or amount
     * @throws IllegalArgumentException when the order omits or repeats a step
     */
    public RecordValidator(List<ValidationStep> order, MalformedTransactionPolicy malformedTransactionPolicy) {
        Set<ValidationStep> distinct = order.isEmpty() ? EnumSet.noneOf(ValidationStep.class) : EnumSet.copyOf(order);
        if (order.size() != ValidationStep.values().length || distinct.size() != order.size()) {
            throw new IllegalArgumentException("Validation order must list every step exactly once: " + order);
        }
        this.order = List.copyOf(order);
        this.malformedTransactionPolicy = malformedTransactionPolicy;
    }

    public List<ValidationStep> order() {
        return order;
    }

    /**
     * Validates a statement.
     *
     * @param filename  reduced source filename
     * @param account   resolved registry entry
     * @param statement classified candidates
     * @return validated record
     * @throws StatementRejectedException with the code of the first violated step
     */
    public StatementRecord validate(ExtractedField<String> filename,
                                    ExtractedField<AccountReference> account,
                                    ExtractedStatement statement) {
        for (ValidationStep step : order) {
            switch (step) {
                case ACCOUNT -> checkAccount(account);
                case STATEMENT_DATE -> checkStatementDate(statement);
                case BALANCES -> checkBalances(statement);
                case PERIOD -> checkPeriod(statement);
                case DOCUMENT_STRUCTURE -> checkStructure(filename, statement);
            }
        }

        List<Deposit> deposits = new ArrayList<>();
        List<Withdrawal> withdrawals = new ArrayList<>();
        for (TransactionRow row : statement.transactions()) {
            if (!row.isWellFormed()) {
                log.warn("Skipping malformed {} row at line {}", row.section(), row.lineNumber());
                continue;
            }
            if (row.section() == TransactionSection.DEPOSITS) {
                deposits.add(new Deposit(row.date().value(), row.description().value(), row.amount().value()));
            } else {
                withdrawals.add(new Withdrawal(row.date().value(), row.description().value(),
                        row.amount().value(), row.taxCategory()));
            }
        }

        return new StatementRecord(
                filename.value(),
                account.value(),
                statement.statementDate().value(),
                statement.periodStart().value(),
                statement.periodEnd().value(),
                statement.beginningBalance().value(),
                statement.endingBalance().value(),
                statement.totalFees().value(),
                statement.importantNotes().orElse(""),
                deposits,
                withdrawals
        );
    }

    private void checkAccount(ExtractedField<AccountReference> account) {
        if (account == null || !account.present()) {
            throw new StatementRejectedException(ErrorCode.INVALID_ACCOUNT,
                    "Account number is missing or not in the account registry.");
        }
    }

    private void checkStatementDate(ExtractedStatement statement) {
        if (!statement.statementDate().present()) {
            throw new StatementRejectedException(ErrorCode.MISSING_STATEMENT_DATE,
                    "Statement date is missing or not a valid calendar date.");
        }
    }

    private void checkBalances(ExtractedStatement statement) {
        if (!statement.beginningBalance().present() || !statement.endingBalance().present()) {
            throw new StatementRejectedException(ErrorCode.MISSING_BALANCE,
                    "Beginning and ending balance are both required.");
        }
    }

    private void checkPeriod(ExtractedStatement statement) {
        if (!statement.periodStart().present() || !statement.periodEnd().present()) {
            throw new StatementRejectedException(ErrorCode.MISSING_PERIOD_DATES,
                    "Statement period start and end are both required.");
        }
        LocalDate start = statement.periodStart().value();
        LocalDate end = statement.periodEnd().value();
        if (end.isBefore(start)) {
            throw new StatementRejectedException(ErrorCode.MISSING_PERIOD_DATES,
                    "Statement period ends before it starts.");
        }
        if (statement.statementDate().present()) {
            LocalDate statementDate = statement.statementDate().value();
            if (statementDate.isBefore(start) || statementDate.isAfter(end)) {
                throw new StatementRejectedException(ErrorCode.MISSING_PERIOD_DATES,
                        "Statement date lies outside the statement period.");
            }
        }
    }

    private void checkStructure(ExtractedField<String> filename, ExtractedStatement statement) {
        if (filename == null || !filename.present()) {
            throw new StatementRejectedException(ErrorCode.PARSE_ERROR,
                    "Source filename must name a .pdf file.");
        }
        if (!statement.totalFees().present()) {
            throw new StatementRejectedException(ErrorCode.PARSE_ERROR,
                    "Total fees could not be read as an amount.");
        }
        if (malformedTransactionPolicy == MalformedTransactionPolicy.REJECT_STATEMENT) {
            for (TransactionRow row : statement.transactions()) {
                if (!row.isWellFormed()) {
                    throw new StatementRejectedException(ErrorCode.PARSE_ERROR,
                            "Malformed " + row.section().name().toLowerCase(Locale.ROOT) + " row at line " + row.lineNumber() + ".");
                }
            }
        }
    }
}
