package com.grouptab.expense.ledger;

import com.grouptab.expense.domain.ParticipantShare;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything needed to create an expense, before ids, timestamps and payment statuses exist
 */
public record ExpenseDraft(String groupId,
                           String eventId,
                           String description,
                           BigDecimal totalAmount,
                           String createdBy,
                           List<ParticipantShare> shares) {
}
