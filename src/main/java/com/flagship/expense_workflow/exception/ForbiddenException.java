package com.flagship.expense_workflow.exception;

/**
 * Raised at the HTTP boundary when the caller's role may not use an endpoint
 * at all, as opposed to a business rule rejecting one particular request.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
