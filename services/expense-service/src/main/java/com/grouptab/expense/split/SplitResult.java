package com.grouptab.expense.split;

import com.grouptab.expense.domain.ParticipantShare;

import java.util.List;

/**
 * Outcome of {@link SplitState#finalize}: either the committed shares, or a corrected state
 * the caller has to show before trying again
 */
public record SplitResult(Status status, SplitState state, List<ParticipantShare> shares) {

    public enum Status {
        FINALIZED,
        NEEDS_CONFIRMATION
    }

    public SplitResult {
        shares = shares == null ? List.of() : List.copyOf(shares);
    }

    static SplitResult finalized(SplitState state, List<ParticipantShare> shares) {
        return new SplitResult(Status.FINALIZED, state, shares);
    }

    static SplitResult needsConfirmation(SplitState corrected) {
        return new SplitResult(Status.NEEDS_CONFIRMATION, corrected, List.of());
    }

    public boolean isFinalized() {
        return status == Status.FINALIZED;
    }
}
