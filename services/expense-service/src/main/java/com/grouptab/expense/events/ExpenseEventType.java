package com.grouptab.expense.events;

public enum ExpenseEventType {
    EXPENSE_CREATED,
    EXPENSE_UPDATED,
    EXPENSE_DELETED,
    PAYMENT_STATUS_CHANGED
}
