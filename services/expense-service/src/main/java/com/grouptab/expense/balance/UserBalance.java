package com.grouptab.expense.balance;

import java.math.BigDecimal;
import java.util.List;

/**
 * A user's aggregated position across a set of expenses.
 * {@code detailedCredits} name who owes the user; {@code detailedDebts} name whom the user owes.
 */
public record UserBalance(BigDecimal netBalance,
                          BigDecimal totalOwed,
                          BigDecimal totalOwing,
                          List<DebtDetail> detailedDebts,
                          List<DebtDetail> detailedCredits) {

    public UserBalance {
        detailedDebts = List.copyOf(detailedDebts);
        detailedCredits = List.copyOf(detailedCredits);
    }

    public static UserBalance empty() {
        return new UserBalance(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, List.of(), List.of());
    }
}
