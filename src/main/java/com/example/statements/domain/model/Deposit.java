package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Validated deposit line of a statement.
 */
public record Deposit(
        LocalDate date,
        String description,
        BigDecimal amount
) {
}
