package com.example.statements.domain.exception;

import com.example.statements.domain.model.ErrorCode;
import com.example.statements.domain.model.ErrorRecord;

/**
 * Raised by a validation step when an extracted statement cannot become a record.
 * The engine converts it into an error payload at its boundary, so it never reaches callers.
 */
public class StatementRejectedException extends DomainException {

    private final ErrorCode code;

	/**
	 * Creates the exception for the given error code.
	 *
	 * @param code    taxonomy code reported to the caller
	 * @param message human readable reason
	 */
    public StatementRejectedException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

	/**
	 * @return error payload carrying this exception's code and message
	 */
    public ErrorRecord toErrorRecord() {
        return new ErrorRecord(code, getMessage());
    }
}
