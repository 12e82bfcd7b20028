package com.grouptab.expense.balance;

import java.util.List;
import java.util.UUID;

/**
 * Who owes the user and whom the user owes on a single expense, zero lines left out
 */
public record ExpenseBreakdown(UUID expenseId, List<DebtDetail> owedToUser, List<DebtDetail> owedByUser) {

    public ExpenseBreakdown {
        owedToUser = List.copyOf(owedToUser);
        owedByUser = List.copyOf(owedByUser);
    }
}
