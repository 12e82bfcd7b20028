package com.grouptab.expense.settlement;

import java.math.BigDecimal;

/**
 * Headline figures for a group's expenses as seen by one user. "Active" means not fully settled.
 */
public record ExpenseSummary(int expenseCount,
                             int activeExpenseCount,
                             BigDecimal activeTotalAmount,
                             int eventsWithExpenses,
                             BigDecimal userOwes,
                             BigDecimal userOwed) {
}
