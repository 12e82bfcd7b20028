package com.grouptab.expense.exception;

/**
 * Base exception for all expense service exceptions
 * Carries a stable error code for programmatic handling by clients
 */
public class ExpenseException extends RuntimeException {

    private final String errorCode;
    private final Object[] args;

    public ExpenseException(String message) {
        super(message);
        this.errorCode = "EXPENSE_ERROR";
        this.args = null;
    }

    public ExpenseException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.args = null;
    }

    public ExpenseException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.args = null;
    }

    public ExpenseException(String errorCode, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getArgs() {
        return args;
    }
}
