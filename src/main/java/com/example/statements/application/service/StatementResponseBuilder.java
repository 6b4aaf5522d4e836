package com.example.statements.application.service;

import com.example.statements.domain.extraction.DateExtractor;
import com.example.statements.domain.model.Deposit;
import com.example.statements.domain.model.ErrorRecord;
import com.example.statements.domain.model.FilenameStrategy;
import com.example.statements.domain.model.StatementPayload;
import com.example.statements.domain.model.StatementRecord;
import com.example.statements.domain.model.StatementResponse;
import com.example.statements.domain.model.Withdrawal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.LocalDate;

/**
 * Wraps validated records and error records into the response envelope and renders it as JSON.
 * Rendering is deterministic: field order is fixed by the payload types and amounts always carry two decimals.
 */
public class StatementResponseBuilder {

    private final FilenameStrategy filenameStrategy;
    private final ObjectMapper objectMapper;

    public StatementResponseBuilder(FilenameStrategy filenameStrategy, ObjectMapper objectMapper) {
        this.filenameStrategy = filenameStrategy;
        this.objectMapper = objectMapper;
    }

    public StatementResponse success(StatementRecord record) {
        StatementPayload payload = new StatementPayload(
                resolveFilename(record),
                record.account().canonicalId(),
                DateExtractor.format(record.statementDate()),
                DateExtractor.format(record.periodStart()),
                DateExtractor.format(record.periodEnd()),
                record.beginningBalance(),
                record.endingBalance(),
                record.totalFees(),
                record.importantNotes(),
                record.deposits().stream().map(this::toPayload).toList(),
                record.withdrawals().stream().map(this::toPayload).toList()
        );
        return StatementResponse.success(payload);
    }

    public StatementResponse error(ErrorRecord error) {
        return StatementResponse.error(error);
    }

    /**
     * Renders a response as JSON.
     *
     * @param response response envelope
     * @return JSON text, identical for equal responses
     * @throws IllegalStateException when Jackson cannot serialize the envelope
     */
    public String toJson(StatementResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to render statement response", e);
        }
    }

    /**
     * Chooses the output filename. The account-month-year form follows the archive naming
     * {@code 1944-01-2023.pdf}.
     */
    private String resolveFilename(StatementRecord record) {
        if (filenameStrategy == FilenameStrategy.ACCOUNT_MONTH_YEAR) {
            LocalDate date = record.statementDate();
            return String.format("%s-%02d-%04d.pdf", record.account().lastFour(), date.getMonthValue(), date.getYear());
        }
        return record.filename();
    }

    private StatementPayload.DepositPayload toPayload(Deposit deposit) {
        return new StatementPayload.DepositPayload(
                DateExtractor.format(deposit.date()), deposit.description(), deposit.amount());
    }

    private StatementPayload.WithdrawalPayload toPayload(Withdrawal withdrawal) {
        return new StatementPayload.WithdrawalPayload(
                DateExtractor.format(withdrawal.date()), withdrawal.description(), withdrawal.amount(),
                withdrawal.taxCategory());
    }
}
