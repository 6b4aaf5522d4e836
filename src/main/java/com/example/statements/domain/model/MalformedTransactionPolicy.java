package com.example.statements.domain.model;

/**
 * What to do with a transaction row that lacks a usable date, description or amount.
 */
public enum MalformedTransactionPolicy {
    /** Drop the row and keep the rest of the statement. */
    SKIP,
    /** Reject the whole statement with {@link ErrorCode#PARSE_ERROR}. */
    REJECT_STATEMENT
}
