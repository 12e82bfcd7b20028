package com.grouptab.expense.balance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Directed money obligation: {@code from} owes {@code to} the given amount
 */
public record Obligation(String from, String to, BigDecimal amount) {

    /**
     * Turns one user's balance back into directed obligations: debts run from the user to the
     * counterparty, credits from the counterparty to the user.
     */
    public static List<Obligation> fromBalance(String userId, UserBalance balance) {
        List<Obligation> obligations = new ArrayList<>();
        balance.detailedDebts().forEach(debt ->
                obligations.add(new Obligation(userId, debt.counterparty(), debt.amount())));
        balance.detailedCredits().forEach(credit ->
                obligations.add(new Obligation(credit.counterparty(), userId, credit.amount())));
        return obligations;
    }
}
