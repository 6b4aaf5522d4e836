package com.example.statements.domain.model;

import java.util.List;

/**
 * Validation checks applied to an extracted statement. The configured order decides which error wins
 * when several conditions are violated at once.
 */
public enum ValidationStep {
    ACCOUNT,
    STATEMENT_DATE,
    BALANCES,
    PERIOD,
    DOCUMENT_STRUCTURE;

    /**
     * @return the default order: account, statement date, balances, period, document structure
     */
    public static List<ValidationStep> defaultOrder() {
        return List.of(values());
    }
}
