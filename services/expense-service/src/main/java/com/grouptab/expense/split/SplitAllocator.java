package com.grouptab.expense.split;

import com.grouptab.expense.domain.ParticipantRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Runs the percentage split of both roles of an expense through {@link SplitState#finalize}
 */
@Slf4j
@Component
public class SplitAllocator {

    /**
     * Starts a split with the given members selected in order, each on an equal share
     */
    public SplitState startSplit(ParticipantRole role, Collection<String> memberIds) {
        SplitState state = SplitState.empty(role);
        for (String memberId : memberIds) {
            state = state.select(memberId);
        }
        return state;
    }

    public SplitAllocation allocate(BigDecimal totalAmount,
                                    Map<String, BigDecimal> payerPercentages,
                                    Map<String, BigDecimal> owerPercentages) {
        SplitResult payers = SplitState.of(ParticipantRole.PAYER, payerPercentages).finalize(totalAmount);
        SplitResult owers = SplitState.of(ParticipantRole.OWER, owerPercentages).finalize(totalAmount);
        SplitAllocation allocation = new SplitAllocation(payers, owers);

        if (allocation.needsConfirmation()) {
            log.debug("Split for total {} needs confirmation: payers={}, owers={}",
                    totalAmount, payers.status(), owers.status());
        }
        return allocation;
    }
}
