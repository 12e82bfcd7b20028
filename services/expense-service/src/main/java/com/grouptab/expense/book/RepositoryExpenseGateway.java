package com.grouptab.expense.book;

import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.entity.ExpenseEntity;
import com.grouptab.expense.exception.ExpenseNotFoundException;
import com.grouptab.expense.repository.ExpenseRepository;
import com.grouptab.expense.settlement.SettlementTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link ExpenseGateway} over the service's own expense store. Expenses are stored under the ids
 * the book assigned, so later edits through the same book find them again. Each call runs in its
 * own transaction on the expense book executor.
 */
@Slf4j
@Component
public class RepositoryExpenseGateway implements ExpenseGateway {

    private final ExpenseRepository expenseRepository;
    private final SettlementTracker settlementTracker;
    private final TransactionTemplate transactionTemplate;
    private final Executor executor;

    public RepositoryExpenseGateway(ExpenseRepository expenseRepository,
                                    SettlementTracker settlementTracker,
                                    TransactionTemplate transactionTemplate,
                                    @Qualifier("expenseBookExecutor") Executor executor) {
        this.expenseRepository = expenseRepository;
        this.settlementTracker = settlementTracker;
        this.transactionTemplate = transactionTemplate;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<List<Expense>> list(String groupId, String eventId) {
        return inTransaction(() -> {
            List<ExpenseEntity> rows = eventId == null
                    ? expenseRepository.findByGroupIdOrderByCreatedAtDesc(groupId)
                    : expenseRepository.findByGroupIdAndEventIdOrderByCreatedAtDesc(groupId, eventId);
            return rows.stream().map(ExpenseEntity::toDomain).toList();
        });
    }

    @Override
    public CompletableFuture<Expense> create(Expense expense) {
        return inTransaction(() -> {
            expenseRepository.save(ExpenseEntity.fromDomain(expense));
            log.debug("Stored expense {} for group {}", expense.id(), expense.groupId());
            return expense;
        });
    }

    @Override
    public CompletableFuture<Expense> update(Expense expense) {
        return inTransaction(() -> {
            ExpenseEntity entity = find(expense.groupId(), expense.id());
            entity.applyFrom(expense);
            expenseRepository.save(entity);
            return expense;
        });
    }

    @Override
    public CompletableFuture<Void> delete(String groupId, UUID expenseId) {
        return inTransaction(() -> {
            expenseRepository.delete(find(groupId, expenseId));
            return null;
        });
    }

    /**
     * Re-checks the transition against the stored row, which may have moved on since the book loaded it
     */
    @Override
    public CompletableFuture<Void> updatePaymentStatus(String groupId,
                                                       UUID expenseId,
                                                       String memberId,
                                                       ParticipantRole role,
                                                       PaymentStatus status) {
        return inTransaction(() -> {
            ExpenseEntity entity = find(groupId, expenseId);
            Expense updated = settlementTracker.withPaymentStatus(entity.toDomain(), memberId, role, status);
            entity.replaceParticipants(updated.participants());
            expenseRepository.save(entity);
            return null;
        });
    }

    private ExpenseEntity find(String groupId, UUID expenseId) {
        return expenseRepository.findByIdAndGroupId(expenseId, groupId)
                .orElseThrow(() -> new ExpenseNotFoundException(expenseId, groupId));
    }

    private <T> CompletableFuture<T> inTransaction(Supplier<T> work) {
        return CompletableFuture.supplyAsync(() -> transactionTemplate.execute(status -> work.get()), executor);
    }
}
