package com.grouptab.expense.book;

import com.grouptab.expense.balance.BalanceCalculator;
import com.grouptab.expense.ledger.ExpenseLedger;
import com.grouptab.expense.settlement.DebtSimplifier;
import com.grouptab.expense.settlement.SettlementTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Opens {@link ExpenseBook}s wired to the shared calculators
 */
@Component
@RequiredArgsConstructor
public class ExpenseBooks {

    private final ExpenseLedger ledger;
    private final SettlementTracker settlementTracker;
    private final BalanceCalculator balanceCalculator;
    private final DebtSimplifier debtSimplifier;

    public ExpenseBook open(String groupId, String eventId, ExpenseGateway gateway) {
        return new ExpenseBook(groupId, eventId, gateway, ledger, settlementTracker, balanceCalculator, debtSimplifier);
    }
}
