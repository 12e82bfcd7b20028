package com.grouptab.expense.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Expense Event - published on every change to a group expense
 *
 * Event types:
 * - EXPENSE_CREATED
 * - EXPENSE_UPDATED
 * - EXPENSE_DELETED
 * - PAYMENT_STATUS_CHANGED (carries member, role and both statuses)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExpenseEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("event_id")
    private String eventId;

    @JsonProperty("event_type")
    private ExpenseEventType eventType;

    @JsonProperty("correlation_id")
    private String correlationId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("version")
    private String version;

    @JsonProperty("expense_id")
    private String expenseId;

    @JsonProperty("group_id")
    private String groupId;

    @JsonProperty("event_ref")
    private String eventRef;

    @JsonProperty("actor_id")
    private String actorId;

    @JsonProperty("description")
    private String description;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("fully_settled")
    private Boolean fullySettled;

    @JsonProperty("member_id")
    private String memberId;

    @JsonProperty("role")
    private String role;

    @JsonProperty("previous_status")
    private String previousStatus;

    @JsonProperty("payment_status")
    private String paymentStatus;
}
