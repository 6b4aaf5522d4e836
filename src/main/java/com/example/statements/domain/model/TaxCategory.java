package com.example.statements.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of tax categories a withdrawal can be filed under.
 */
public enum TaxCategory {
    DOMESTIC_BUSINESS_EXPENSE("Domestic Business Expense"),
    INTERNATIONAL_SUBCONTRACTORS("International Subcontractors"),
    TAX_PAYMENT("Tax Payment"),
    TRANSFER("Transfer"),
    LOAN_PAYMENT("Loan Payment"),
    UTILITY_PAYMENT("Utility Payment"),
    PROFESSIONAL_SERVICES("Professional Services");

    private final String label;

    TaxCategory(String label) {
        this.label = label;
    }

    /**
     * @return the exact string written to the output payload
     */
    @JsonValue
    public String label() {
        return label;
    }
}
