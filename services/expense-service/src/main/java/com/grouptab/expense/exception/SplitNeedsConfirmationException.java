package com.grouptab.expense.exception;

import com.grouptab.expense.split.SplitAllocation;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown when a submitted split did not add up to 100% and had to be rescaled.
 * Nothing is persisted; the corrected percentages go back to the caller for confirmation.
 * Results in HTTP 409 Conflict
 */
public class SplitNeedsConfirmationException extends ExpenseException {

    private final transient SplitAllocation allocation;

    public SplitNeedsConfirmationException(SplitAllocation allocation) {
        super("SPLIT_NEEDS_CONFIRMATION",
              "Percentages did not add up to 100% and were rescaled; resubmit to confirm");
        this.allocation = allocation;
    }

    public SplitAllocation getAllocation() {
        return allocation;
    }

    public Map<String, BigDecimal> getPayerPercentages() {
        return allocation.payers().state().percentages();
    }

    public Map<String, BigDecimal> getOwerPercentages() {
        return allocation.owers().state().percentages();
    }
}
