package com.grouptab.expense.settlement;

/**
 * How far the owers of an expense have got with paying
 */
public enum SettlementProgress {
    /**
     * No ower has sent or completed a payment
     */
    PENDING,

    /**
     * At least one ower has sent or completed, but not all have completed
     */
    IN_PROGRESS,

    /**
     * Every ower has completed
     */
    COMPLETED
}
