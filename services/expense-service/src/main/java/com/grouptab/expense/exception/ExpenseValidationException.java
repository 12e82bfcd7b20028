package com.grouptab.expense.exception;

/**
 * Thrown when an expense, participant row or split fails validation
 * Results in HTTP 400 Bad Request
 */
public class ExpenseValidationException extends ExpenseException {

    public ExpenseValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
