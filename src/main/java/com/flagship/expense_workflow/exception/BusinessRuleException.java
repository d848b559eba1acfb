package com.flagship.expense_workflow.exception;

/**
 * Raised when a domain precondition is violated.
 *
 * The message names the violated rule and is returned to the caller as-is,
 * so it must stay human readable. Callers never retry on this exception:
 * the requested operation is rejected and no state has changed.
 */
public class BusinessRuleException extends RuntimeException {

    public BusinessRuleException(String message) {
        super(message);
    }
}
