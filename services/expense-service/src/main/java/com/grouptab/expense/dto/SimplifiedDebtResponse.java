package com.grouptab.expense.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimplifiedDebtResponse {

    private String from;

    private String fromName;

    private String to;

    private String toName;

    private BigDecimal amount;
}
