package com.grouptab.expense.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebtDetailResponse {

    private UUID expenseId;

    private String expenseName;

    private String counterparty;

    private String counterpartyName;

    private BigDecimal amount;
}
