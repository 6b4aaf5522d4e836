package com.example.statements.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Known bank account that statements may be filed against.
 * Entries are loaded once at startup and never change while the application runs.
 */
@JsonPropertyOrder({"canonical_id", "company_name", "bank_name", "digit_length", "account_type"})
public record AccountReference(
        @JsonProperty("canonical_id") String canonicalId,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("bank_name") String bankName,
        @JsonProperty("digit_length") int digitLength,
        @JsonProperty("account_type") String accountType
) {

    /**
     * @return last four digits of the canonical id, used wherever the number is shown or logged
     */
    @JsonIgnore
    public String lastFour() {
        return canonicalId.length() <= 4 ? canonicalId : canonicalId.substring(canonicalId.length() - 4);
    }
}
