package com.grouptab.expense.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request DTO for creating or replacing an expense.
 * Percentages are keyed by member id; the key order is the selection order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpenseRequest {

    @Size(max = 500, message = "Description must not exceed 500 characters")
    private String description;

    @Size(max = 100, message = "Event ID must not exceed 100 characters")
    private String eventId;

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    @Digits(integer = 17, fraction = 2, message = "Total amount must have at most 2 decimal places")
    @JsonDeserialize(using = FlexibleDecimalDeserializer.class)
    private BigDecimal totalAmount;

    @NotEmpty(message = "At least one payer is required")
    @Size(max = 100, message = "Maximum 100 payers allowed")
    @JsonDeserialize(contentUsing = FlexibleDecimalDeserializer.class)
    private Map<String, BigDecimal> payerPercentages;

    @NotEmpty(message = "At least one ower is required")
    @Size(max = 100, message = "Maximum 100 owers allowed")
    @JsonDeserialize(contentUsing = FlexibleDecimalDeserializer.class)
    private Map<String, BigDecimal> owerPercentages;
}
