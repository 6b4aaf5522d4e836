package com.example.statements.domain.model;

/**
 * Error taxonomy of the extraction engine. Exactly one code is reported per rejected statement.
 */
public enum ErrorCode {
    INVALID_ACCOUNT,
    MISSING_STATEMENT_DATE,
    MISSING_BALANCE,
    MISSING_PERIOD_DATES,
    PARSE_ERROR
}
