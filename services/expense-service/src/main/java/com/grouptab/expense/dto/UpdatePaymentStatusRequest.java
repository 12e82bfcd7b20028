package com.grouptab.expense.dto;

import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for moving one participant row to a new payment status
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePaymentStatusRequest {

    @NotBlank(message = "Member ID is required")
    private String memberId;

    @Builder.Default
    private ParticipantRole role = ParticipantRole.OWER;

    @NotNull(message = "Payment status is required")
    private PaymentStatus paymentStatus;

    public ParticipantRole getRole() {
        return role != null ? role : ParticipantRole.OWER;
    }
}
