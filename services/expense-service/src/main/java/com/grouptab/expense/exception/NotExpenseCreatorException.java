package com.grouptab.expense.exception;

import java.util.UUID;

/**
 * Exception thrown when someone other than the creator tries to delete an expense
 * Results in HTTP 403 Forbidden
 */
public class NotExpenseCreatorException extends ExpenseException {

    public NotExpenseCreatorException(UUID expenseId, String memberId) {
        super("NOT_EXPENSE_CREATOR",
              String.format("Only the expense creator can delete expense %s (requested by %s)", expenseId, memberId),
              expenseId, memberId);
    }
}
