package com.grouptab.expense.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Response DTO for a member's balance. Positive {@code netBalance} means the group owes the member.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    private String userId;

    private BigDecimal netBalance;

    private BigDecimal totalOwed;

    private BigDecimal totalOwing;

    private List<DebtDetailResponse> detailedDebts;

    private List<DebtDetailResponse> detailedCredits;
}
