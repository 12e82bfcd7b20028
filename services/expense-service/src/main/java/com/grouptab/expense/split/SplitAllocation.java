package com.grouptab.expense.split;

import com.grouptab.expense.domain.ParticipantShare;

import java.util.ArrayList;
import java.util.List;

/**
 * Finalize results for both roles of one expense
 */
public record SplitAllocation(SplitResult payers, SplitResult owers) {

    public boolean needsConfirmation() {
        return !payers.isFinalized() || !owers.isFinalized();
    }

    /**
     * Payer shares followed by ower shares. Empty unless both roles finalized.
     */
    public List<ParticipantShare> shares() {
        if (needsConfirmation()) {
            return List.of();
        }
        List<ParticipantShare> all = new ArrayList<>(payers.shares());
        all.addAll(owers.shares());
        return List.copyOf(all);
    }
}
