package com.grouptab.expense.ledger;

import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.exception.ExpenseValidationException;
import com.grouptab.expense.exception.NotExpenseCreatorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Assembles validated {@link Expense} records from finalized shares.
 *
 * <p>New rows start with {@link PaymentStatus#initialFor}: payers are {@code completed} because
 * they fronted the money when the expense was entered, owers are {@code pending}.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpenseLedger {

    static final String DEFAULT_DESCRIPTION = "Expense";

    private final Clock clock;

    public Expense create(ExpenseDraft draft) {
        requirePositive(draft.totalAmount());
        requireBothRoles(draft.shares());

        Instant now = clock.instant();
        List<Participant> participants = draft.shares().stream()
                .map(share -> Participant.of(share, PaymentStatus.initialFor(share.role())))
                .toList();

        Expense expense = new Expense(
                UUID.randomUUID(),
                draft.groupId(),
                blankToNull(draft.eventId()),
                descriptionOrDefault(draft.description()),
                draft.totalAmount(),
                draft.createdBy(),
                now,
                now,
                participants);

        log.debug("Assembled expense {} in group {} with {} participants",
                expense.id(), expense.groupId(), participants.size());
        return expense;
    }

    /**
     * Replaces description, total and the whole participant set. Rows that already existed for the
     * same member and role keep their payment status; new rows get the initial status.
     */
    public Expense update(Expense existing, String description, BigDecimal totalAmount, List<ParticipantShare> shares) {
        requirePositive(totalAmount);
        requireBothRoles(shares);

        List<Participant> participants = shares.stream()
                .map(share -> Participant.of(share, previousStatus(existing, share)))
                .toList();

        return new Expense(
                existing.id(),
                existing.groupId(),
                existing.eventId(),
                descriptionOrDefault(description),
                totalAmount,
                existing.createdBy(),
                existing.createdAt(),
                clock.instant(),
                participants);
    }

    public boolean canDelete(Expense expense, String memberId) {
        return expense.isCreatedBy(memberId);
    }

    public void assertCanDelete(Expense expense, String memberId) {
        if (!canDelete(expense, memberId)) {
            throw new NotExpenseCreatorException(expense.id(), memberId);
        }
    }

    private static PaymentStatus previousStatus(Expense existing, ParticipantShare share) {
        return existing.participants().stream()
                .filter(p -> p.matches(share.memberId(), share.role()))
                .map(Participant::paymentStatus)
                .findFirst()
                .orElse(PaymentStatus.initialFor(share.role()));
    }

    private static void requirePositive(BigDecimal totalAmount) {
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new ExpenseValidationException("Total amount must be greater than 0");
        }
        if (totalAmount.stripTrailingZeros().scale() > 2) {
            throw new ExpenseValidationException(
                    "Total amount must not have more than 2 decimal places, was " + totalAmount.toPlainString());
        }
    }

    private static void requireBothRoles(List<ParticipantShare> shares) {
        if (shares == null || shares.stream().noneMatch(s -> s.role() == ParticipantRole.PAYER)) {
            throw new ExpenseValidationException("At least one payer is required");
        }
        if (shares.stream().noneMatch(s -> s.role() == ParticipantRole.OWER)) {
            throw new ExpenseValidationException("At least one ower is required");
        }
    }

    private static String descriptionOrDefault(String description) {
        return description == null || description.isBlank() ? DEFAULT_DESCRIPTION : description.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
