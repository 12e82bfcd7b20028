package com.grouptab.expense.exception;

import java.util.UUID;

/**
 * Exception thrown when an expense is not found
 * Results in HTTP 404 Not Found
 */
public class ExpenseNotFoundException extends ExpenseException {

    public ExpenseNotFoundException(UUID expenseId) {
        super("EXPENSE_NOT_FOUND", "Expense not found with ID: " + expenseId, expenseId);
    }

    public ExpenseNotFoundException(UUID expenseId, String groupId) {
        super("EXPENSE_NOT_FOUND",
              String.format("Expense not found with ID: %s in group: %s", expenseId, groupId),
              expenseId, groupId);
    }
}
