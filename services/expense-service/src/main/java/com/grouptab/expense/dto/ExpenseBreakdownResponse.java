package com.grouptab.expense.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseBreakdownResponse {

    private UUID expenseId;

    private List<DebtDetailResponse> owedToUser;

    private List<DebtDetailResponse> owedByUser;
}
