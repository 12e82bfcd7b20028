package com.grouptab.expense.balance;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One expense's contribution to a user's position against a single counterparty
 */
public record DebtDetail(UUID expenseId, String expenseName, String counterparty, BigDecimal amount) {
}
