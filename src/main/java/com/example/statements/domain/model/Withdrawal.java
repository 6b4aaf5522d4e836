package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Validated withdrawal line of a statement together with its tax category.
 */
public record Withdrawal(
        LocalDate date,
        String description,
        BigDecimal amount,
        TaxCategory taxCategory
) {
}
