package com.grouptab.expense.entity;

import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.Participant;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Persistent form of an {@link Expense}. Ids and timestamps are assigned by the domain layer,
 * participants are owned by the expense and removed with it.
 */
@Entity
@Table(name = "group_expenses", indexes = {
        @Index(name = "idx_expense_group_id", columnList = "group_id"),
        @Index(name = "idx_expense_group_event", columnList = "group_id, event_id"),
        @Index(name = "idx_expense_created_by", columnList = "created_by")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpenseEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "group_id", nullable = false, length = 100)
    private String groupId;

    @Column(name = "event_id", length = 100)
    private String eventId;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "expense", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    @Builder.Default
    @ToString.Exclude
    private List<ExpenseParticipantEntity> participants = new ArrayList<>();

    /**
     * Version field for optimistic locking. A null version marks a row that has not been
     * inserted yet, since the id is always assigned up front.
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public static ExpenseEntity fromDomain(Expense expense) {
        ExpenseEntity entity = ExpenseEntity.builder()
                .id(expense.id())
                .groupId(expense.groupId())
                .eventId(expense.eventId())
                .description(expense.description())
                .totalAmount(expense.totalAmount())
                .createdBy(expense.createdBy())
                .createdAt(expense.createdAt())
                .updatedAt(expense.updatedAt())
                .build();
        entity.replaceParticipants(expense.participants());
        return entity;
    }

    /**
     * Copies the mutable fields of an edited expense onto this managed row
     */
    public void applyFrom(Expense expense) {
        this.description = expense.description();
        this.totalAmount = expense.totalAmount();
        this.updatedAt = expense.updatedAt();
        replaceParticipants(expense.participants());
    }

    /**
     * Rows already present for the same member and role are updated in place; the unique
     * (expense, member, role) key would otherwise clash, since inserts are flushed before deletes.
     */
    public void replaceParticipants(List<Participant> replacement) {
        List<ExpenseParticipantEntity> kept = new ArrayList<>(replacement.size());
        for (int i = 0; i < replacement.size(); i++) {
            Participant participant = replacement.get(i);
            ExpenseParticipantEntity row = participants.stream()
                    .filter(existing -> existing.matches(participant))
                    .findFirst()
                    .orElseGet(() -> ExpenseParticipantEntity.fromDomain(participant, this));
            row.setIndividualAmount(participant.individualAmount());
            row.setPaymentStatus(participant.paymentStatus());
            row.setPosition(i);
            kept.add(row);
        }
        participants.retainAll(kept);
        kept.stream().filter(row -> !participants.contains(row)).forEach(participants::add);
        participants.sort(Comparator.comparingInt(ExpenseParticipantEntity::getPosition));
    }

    public Expense toDomain() {
        return new Expense(
                id,
                groupId,
                eventId,
                description,
                totalAmount,
                createdBy,
                createdAt,
                updatedAt,
                participants.stream().map(ExpenseParticipantEntity::toDomain).toList());
    }
}
