package com.grouptab.expense.settlement;

import com.grouptab.expense.balance.BalanceCalculator;
import com.grouptab.expense.balance.UserBalance;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.exception.InvalidPaymentStatusTransitionException;
import com.grouptab.expense.exception.ParticipantNotFoundException;
import com.grouptab.expense.support.OptimisticUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Payment status state machine and the expense-level settlement predicate.
 *
 * <p>Statuses only move forward: pending, sent, completed. Re-applying the current status is a
 * no-op.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementTracker {

    private final BalanceCalculator balanceCalculator;

    /**
     * An expense is settled when every ower row is completed <em>or</em> every payer row is
     * completed. Either side can close it on its own.
     */
    public static boolean isFullySettled(Expense expense) {
        boolean allOwersCompleted = expense.owers().stream().allMatch(Participant::isCompleted);
        boolean allPayersCompleted = expense.payers().stream().allMatch(Participant::isCompleted);
        return allOwersCompleted || allPayersCompleted;
    }

    public static SettlementProgress progress(Expense expense) {
        List<Participant> owers = expense.owers();
        long completed = owers.stream().filter(Participant::isCompleted).count();
        long sent = owers.stream().filter(p -> p.paymentStatus() == PaymentStatus.SENT).count();

        if (completed == owers.size()) {
            return SettlementProgress.COMPLETED;
        }
        if (sent > 0 || completed > 0) {
            return SettlementProgress.IN_PROGRESS;
        }
        return SettlementProgress.PENDING;
    }

    public Participant advance(Participant row, PaymentStatus status) {
        Objects.requireNonNull(status, "status");
        if (!row.paymentStatus().canMoveTo(status)) {
            throw new InvalidPaymentStatusTransitionException(row.paymentStatus(), status);
        }
        if (row.paymentStatus() == status) {
            return row;
        }
        return row.withPaymentStatus(status);
    }

    /**
     * Returns a copy of the expense with one participant row moved to {@code status}
     */
    public Expense withPaymentStatus(Expense expense, String memberId, ParticipantRole role, PaymentStatus status) {
        boolean found = false;
        List<Participant> rows = new ArrayList<>(expense.participants().size());
        for (Participant participant : expense.participants()) {
            if (participant.matches(memberId, role)) {
                rows.add(advance(participant, status));
                found = true;
            } else {
                rows.add(participant);
            }
        }
        if (!found) {
            throw new ParticipantNotFoundException(expense.id(), memberId, role);
        }
        return expense.withParticipants(rows, expense.updatedAt());
    }

    /**
     * Optimistically moves a single row: the new status is visible through {@code row} at once
     * and the previous one is restored if {@code persist} fails.
     */
    public CompletableFuture<Participant> setPaymentStatus(AtomicReference<Participant> row,
                                                           PaymentStatus status,
                                                           Function<Participant, ? extends CompletionStage<?>> persist) {
        return OptimisticUpdate.apply(row, current -> advance(current, status), persist)
                .whenComplete((updated, error) -> {
                    if (error == null) {
                        log.debug("Payment status for {} ({}) is now {}",
                                updated.memberId(), updated.role().wireName(), updated.paymentStatus().wireName());
                    }
                });
    }

    public List<Expense> activeExpenses(Collection<Expense> expenses) {
        return expenses.stream().filter(expense -> !isFullySettled(expense)).toList();
    }

    public ExpenseSummary summarize(Collection<Expense> expenses, String userId) {
        List<Expense> active = activeExpenses(expenses);
        BigDecimal activeTotal = active.stream()
                .map(Expense::totalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        int events = (int) expenses.stream()
                .map(Expense::eventId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        UserBalance balance = balanceCalculator.calculate(active, userId);

        return new ExpenseSummary(
                expenses.size(),
                active.size(),
                activeTotal,
                events,
                balance.totalOwing(),
                balance.totalOwed());
    }
}
