package com.grouptab.expense.exception;

import com.grouptab.expense.domain.ParticipantRole;

import java.util.UUID;

/**
 * Exception thrown when an expense has no participant row for a member and role
 * Results in HTTP 404 Not Found
 */
public class ParticipantNotFoundException extends ExpenseException {

    public ParticipantNotFoundException(UUID expenseId, String memberId, ParticipantRole role) {
        super("PARTICIPANT_NOT_FOUND",
              String.format("No %s row for member %s on expense %s", role.wireName(), memberId, expenseId),
              expenseId, memberId, role);
    }
}
