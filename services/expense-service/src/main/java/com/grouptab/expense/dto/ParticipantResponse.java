package com.grouptab.expense.dto;

import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantResponse {

    private String memberId;

    private String displayName;

    private ParticipantRole role;

    private BigDecimal individualAmount;

    private PaymentStatus paymentStatus;
}
