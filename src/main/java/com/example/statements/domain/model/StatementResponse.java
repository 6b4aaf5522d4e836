package com.example.statements.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Response envelope. Exactly one of {@code data} and {@code error} is set, matching {@code status}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "data", "error"})
public record StatementResponse(
        String status,
        StatementPayload data,
        ErrorRecord error
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static StatementResponse success(StatementPayload data) {
        return new StatementResponse(SUCCESS, data, null);
    }

    public static StatementResponse error(ErrorRecord error) {
        return new StatementResponse(ERROR, null, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
