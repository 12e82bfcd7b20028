package com.grouptab.expense.book;

import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Remote store behind an {@link ExpenseBook}. Implementations must not block the calling thread
 * and must not retry; a failed future is reported back as-is.
 */
public interface ExpenseGateway {

    /**
     * @param eventId optional; {@code null} lists every expense in the group
     */
    CompletableFuture<List<Expense>> list(String groupId, String eventId);

    CompletableFuture<Expense> create(Expense expense);

    CompletableFuture<Expense> update(Expense expense);

    CompletableFuture<Void> delete(String groupId, UUID expenseId);

    CompletableFuture<Void> updatePaymentStatus(String groupId,
                                                UUID expenseId,
                                                String memberId,
                                                ParticipantRole role,
                                                PaymentStatus status);
}
