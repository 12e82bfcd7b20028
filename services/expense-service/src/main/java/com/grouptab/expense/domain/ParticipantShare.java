package com.grouptab.expense.domain;

import com.grouptab.expense.exception.ExpenseValidationException;

import java.math.BigDecimal;

/**
 * A member's finalized share of one role of an expense, before a payment status is assigned
 */
public record ParticipantShare(String memberId, ParticipantRole role, BigDecimal amount) {

    public ParticipantShare {
        if (memberId == null || memberId.isBlank()) {
            throw new ExpenseValidationException("Participant member id is required");
        }
        if (role == null) {
            throw new ExpenseValidationException("Participant role is required for member " + memberId);
        }
        if (amount == null || amount.signum() < 0) {
            throw new ExpenseValidationException("Participant amount must be zero or positive for member " + memberId);
        }
    }
}
