package com.grouptab.expense.exception;

/**
 * Raised through the returned future when the remote write behind an optimistic
 * update fails and the local state has been rolled back
 */
public class OptimisticUpdateException extends ExpenseException {

    public OptimisticUpdateException(String message, Throwable cause) {
        super("REMOTE_WRITE_FAILED", message, cause);
    }
}
