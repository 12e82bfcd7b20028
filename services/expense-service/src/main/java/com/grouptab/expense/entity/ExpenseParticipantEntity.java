package com.grouptab.expense.entity;

import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One participant row of a group expense
 */
@Entity
@Table(name = "expense_participants",
        uniqueConstraints = @UniqueConstraint(name = "uk_participant_expense_member_role",
                columnNames = {"expense_id", "member_id", "role"}),
        indexes = {
                @Index(name = "idx_participant_expense_id", columnList = "expense_id"),
                @Index(name = "idx_participant_member_id", columnList = "member_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExpenseParticipantEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "expense_id", nullable = false)
    @ToString.Exclude
    private ExpenseEntity expense;

    @Column(name = "member_id", nullable = false, length = 100)
    private String memberId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 10)
    private ParticipantRole role;

    @Column(name = "individual_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal individualAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "sort_order", nullable = false)
    private int position;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static ExpenseParticipantEntity fromDomain(Participant participant, ExpenseEntity expense) {
        return ExpenseParticipantEntity.builder()
                .expense(expense)
                .memberId(participant.memberId())
                .role(participant.role())
                .individualAmount(participant.individualAmount())
                .paymentStatus(participant.paymentStatus())
                .build();
    }

    public boolean matches(Participant participant) {
        return role == participant.role() && memberId.equals(participant.memberId());
    }

    public Participant toDomain() {
        return new Participant(memberId, role, individualAmount, paymentStatus);
    }
}
