package com.grouptab.expense.domain;

import com.grouptab.expense.exception.ExpenseValidationException;

import java.math.BigDecimal;

/**
 * One participant row of an expense
 */
public record Participant(String memberId,
                          ParticipantRole role,
                          BigDecimal individualAmount,
                          PaymentStatus paymentStatus) {

    public Participant {
        if (memberId == null || memberId.isBlank()) {
            throw new ExpenseValidationException("Participant member id is required");
        }
        if (role == null) {
            throw new ExpenseValidationException("Participant role is required for member " + memberId);
        }
        if (individualAmount == null || individualAmount.signum() < 0) {
            throw new ExpenseValidationException("Individual amount must be zero or positive for member " + memberId);
        }
        if (paymentStatus == null) {
            throw new ExpenseValidationException("Payment status is required for member " + memberId);
        }
    }

    public static Participant of(ParticipantShare share, PaymentStatus paymentStatus) {
        return new Participant(share.memberId(), share.role(), share.amount(), paymentStatus);
    }

    public boolean isPayer() {
        return role == ParticipantRole.PAYER;
    }

    public boolean isOwer() {
        return role == ParticipantRole.OWER;
    }

    public boolean isCompleted() {
        return paymentStatus == PaymentStatus.COMPLETED;
    }

    public boolean matches(String memberId, ParticipantRole role) {
        return this.role == role && this.memberId.equals(memberId);
    }

    public Participant withPaymentStatus(PaymentStatus status) {
        return new Participant(memberId, role, individualAmount, status);
    }
}
