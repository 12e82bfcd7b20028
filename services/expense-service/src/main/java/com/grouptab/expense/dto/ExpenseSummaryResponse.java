package com.grouptab.expense.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Response DTO for the group expense indicator
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseSummaryResponse {

    private int expenseCount;

    private int activeExpenseCount;

    private BigDecimal activeTotalAmount;

    private int eventsWithExpenses;

    private BigDecimal userOwes;

    private BigDecimal userOwed;
}
