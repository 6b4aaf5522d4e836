package com.example.statements.domain.model;

/**
 * Statement section a transaction row was read from.
 */
public enum TransactionSection {
    DEPOSITS,
    WITHDRAWALS
}
