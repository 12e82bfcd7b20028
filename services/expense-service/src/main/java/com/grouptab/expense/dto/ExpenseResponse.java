package com.grouptab.expense.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.grouptab.expense.settlement.SettlementProgress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a group expense
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExpenseResponse {

    private UUID id;

    private String groupId;

    private String eventId;

    private String description;

    private BigDecimal totalAmount;

    private String createdBy;

    private String createdByName;

    private boolean fullySettled;

    private SettlementProgress progress;

    private List<ParticipantResponse> participants;

    private Instant createdAt;

    private Instant updatedAt;
}
