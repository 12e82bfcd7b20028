package com.grouptab.expense.domain;

import com.grouptab.expense.exception.ExpenseValidationException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A shared expense with its full participant set. All invariants are checked on construction,
 * so any {@code Expense} instance in hand is internally consistent.
 */
public record Expense(UUID id,
                      String groupId,
                      String eventId,
                      String description,
                      BigDecimal totalAmount,
                      String createdBy,
                      Instant createdAt,
                      Instant updatedAt,
                      List<Participant> participants) {

    /**
     * Maximum gap allowed between a role's summed shares and the total
     */
    public static final BigDecimal SUM_TOLERANCE = new BigDecimal("0.01");

    public Expense {
        if (id == null) {
            throw new ExpenseValidationException("Expense id is required");
        }
        if (groupId == null || groupId.isBlank()) {
            throw new ExpenseValidationException("Group id is required");
        }
        if (description == null || description.isBlank()) {
            throw new ExpenseValidationException("Description is required");
        }
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new ExpenseValidationException("Total amount must be greater than 0");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ExpenseValidationException("Creator is required");
        }
        participants = participants == null ? List.of() : List.copyOf(participants);
        validateRole(participants, ParticipantRole.PAYER, totalAmount);
        validateRole(participants, ParticipantRole.OWER, totalAmount);
    }

    public List<Participant> payers() {
        return participants.stream().filter(Participant::isPayer).toList();
    }

    public List<Participant> owers() {
        return participants.stream().filter(Participant::isOwer).toList();
    }

    public BigDecimal roleTotal(ParticipantRole role) {
        return sumOf(participants, role);
    }

    public boolean isCreatedBy(String memberId) {
        return createdBy.equals(memberId);
    }

    public Expense withParticipants(List<Participant> replacement, Instant now) {
        return new Expense(id, groupId, eventId, description, totalAmount, createdBy, createdAt, now, replacement);
    }

    private static void validateRole(List<Participant> participants, ParticipantRole role, BigDecimal totalAmount) {
        Set<String> seen = new HashSet<>();
        boolean any = false;
        for (Participant participant : participants) {
            if (participant.role() != role) {
                continue;
            }
            any = true;
            if (!seen.add(participant.memberId())) {
                throw new ExpenseValidationException(
                        "Member " + participant.memberId() + " appears more than once as " + role.wireName());
            }
        }
        if (!any) {
            throw new ExpenseValidationException("At least one " + role.wireName() + " is required");
        }
        BigDecimal sum = sumOf(participants, role);
        if (sum.subtract(totalAmount).abs().compareTo(SUM_TOLERANCE) > 0) {
            throw new ExpenseValidationException(String.format(
                    "%s amounts sum to %s but the total is %s", role.wireName(), sum.toPlainString(),
                    totalAmount.toPlainString()));
        }
    }

    private static BigDecimal sumOf(List<Participant> participants, ParticipantRole role) {
        return participants.stream()
                .filter(p -> p.role() == role)
                .map(Participant::individualAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
