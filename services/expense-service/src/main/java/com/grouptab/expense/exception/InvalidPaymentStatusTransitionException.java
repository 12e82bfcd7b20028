package com.grouptab.expense.exception;

import com.grouptab.expense.domain.PaymentStatus;

/**
 * Exception thrown when a payment status would move backwards
 * For example: completed back to pending
 * Results in HTTP 409 Conflict
 */
public class InvalidPaymentStatusTransitionException extends ExpenseException {

    public InvalidPaymentStatusTransitionException(PaymentStatus currentStatus, PaymentStatus requestedStatus) {
        super("INVALID_PAYMENT_STATUS_TRANSITION",
              String.format("Payment status is '%s' and cannot move back to '%s'",
                          currentStatus.wireName(), requestedStatus.wireName()),
              currentStatus, requestedStatus);
    }
}
