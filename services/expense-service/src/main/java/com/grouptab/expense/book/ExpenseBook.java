package com.grouptab.expense.book;

import com.grouptab.expense.balance.BalanceCalculator;
import com.grouptab.expense.balance.UserBalance;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.exception.ExpenseNotFoundException;
import com.grouptab.expense.ledger.ExpenseDraft;
import com.grouptab.expense.ledger.ExpenseLedger;
import com.grouptab.expense.settlement.DebtSimplifier;
import com.grouptab.expense.settlement.ExpenseSummary;
import com.grouptab.expense.settlement.SettlementTracker;
import com.grouptab.expense.settlement.SimplifiedDebt;
import com.grouptab.expense.support.OptimisticUpdate;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Local, optimistically updated copy of the expenses of one group (or one event in it).
 *
 * <p>Every mutation is validated and applied to the local list before the gateway call goes out,
 * so {@link #expenses()} and the derived balances reflect it immediately. A failed gateway call
 * restores the previous list and the returned future fails with
 * {@link com.grouptab.expense.exception.OptimisticUpdateException}. Validation failures are thrown
 * directly and never reach the gateway.</p>
 *
 * <p>Thread-safe. Reads never block.</p>
 */
@Slf4j
public class ExpenseBook {

    @Getter
    private final String groupId;
    @Getter
    private final String eventId;

    private final ExpenseGateway gateway;
    private final ExpenseLedger ledger;
    private final SettlementTracker settlementTracker;
    private final BalanceCalculator balanceCalculator;
    private final DebtSimplifier debtSimplifier;

    private final AtomicReference<List<Expense>> state = new AtomicReference<>(List.of());

    ExpenseBook(String groupId,
                String eventId,
                ExpenseGateway gateway,
                ExpenseLedger ledger,
                SettlementTracker settlementTracker,
                BalanceCalculator balanceCalculator,
                DebtSimplifier debtSimplifier) {
        this.groupId = groupId;
        this.eventId = eventId;
        this.gateway = gateway;
        this.ledger = ledger;
        this.settlementTracker = settlementTracker;
        this.balanceCalculator = balanceCalculator;
        this.debtSimplifier = debtSimplifier;
    }

    /**
     * Replaces the local list with the gateway's. On failure the local list is left untouched.
     */
    public CompletableFuture<List<Expense>> refresh() {
        return gateway.list(groupId, eventId).thenApply(loaded -> {
            List<Expense> snapshot = List.copyOf(loaded);
            state.set(snapshot);
            log.debug("Loaded {} expenses for group {} event {}", snapshot.size(), groupId, eventId);
            return snapshot;
        });
    }

    public CompletableFuture<Expense> create(ExpenseDraft draft) {
        Expense created = ledger.create(draft);
        return OptimisticUpdate.apply(state,
                        current -> prepend(current, created),
                        ignored -> gateway.create(created))
                .thenApply(ignored -> created);
    }

    public CompletableFuture<Expense> update(UUID expenseId,
                                             String description,
                                             BigDecimal totalAmount,
                                             List<ParticipantShare> shares) {
        return OptimisticUpdate.apply(state,
                        current -> replace(current, ledger.update(find(current, expenseId), description, totalAmount, shares)),
                        updated -> gateway.update(find(updated, expenseId)))
                .thenApply(updated -> find(updated, expenseId));
    }

    /**
     * Removes an expense. Only its creator may do so.
     */
    public CompletableFuture<Void> delete(UUID expenseId, String requesterId) {
        return OptimisticUpdate.apply(state,
                        current -> {
                            ledger.assertCanDelete(find(current, expenseId), requesterId);
                            return remove(current, expenseId);
                        },
                        ignored -> gateway.delete(groupId, expenseId))
                .thenAccept(ignored -> log.debug("Deleted expense {} from group {}", expenseId, groupId));
    }

    public CompletableFuture<Expense> setPaymentStatus(UUID expenseId,
                                                       String memberId,
                                                       ParticipantRole role,
                                                       PaymentStatus status) {
        return OptimisticUpdate.apply(state,
                        current -> replace(current,
                                settlementTracker.withPaymentStatus(find(current, expenseId), memberId, role, status)),
                        ignored -> gateway.updatePaymentStatus(groupId, expenseId, memberId, role, status))
                .thenApply(updated -> find(updated, expenseId));
    }

    public List<Expense> expenses() {
        return state.get();
    }

    public List<Expense> activeExpenses() {
        return settlementTracker.activeExpenses(state.get());
    }

    public UserBalance balanceFor(String userId) {
        return balanceCalculator.calculate(state.get(), userId);
    }

    public List<SimplifiedDebt> settlementPlan() {
        return debtSimplifier.simplify(balanceCalculator.obligations(state.get()));
    }

    public ExpenseSummary summaryFor(String userId) {
        return settlementTracker.summarize(state.get(), userId);
    }

    private Expense find(List<Expense> expenses, UUID expenseId) {
        return expenses.stream()
                .filter(expense -> expense.id().equals(expenseId))
                .findFirst()
                .orElseThrow(() -> new ExpenseNotFoundException(expenseId, groupId));
    }

    private static List<Expense> prepend(List<Expense> expenses, Expense expense) {
        List<Expense> next = new ArrayList<>(expenses.size() + 1);
        next.add(expense);
        next.addAll(expenses);
        return List.copyOf(next);
    }

    private static List<Expense> replace(List<Expense> expenses, Expense replacement) {
        return expenses.stream()
                .map(expense -> expense.id().equals(replacement.id()) ? replacement : expense)
                .toList();
    }

    private static List<Expense> remove(List<Expense> expenses, UUID expenseId) {
        return expenses.stream()
                .filter(expense -> !expense.id().equals(expenseId))
                .toList();
    }
}
