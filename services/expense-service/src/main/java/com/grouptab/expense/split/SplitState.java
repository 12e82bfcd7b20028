package com.grouptab.expense.split;

import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.exception.ExpenseValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable percentage split of one role of an expense.
 *
 * <p>Holds the selected members in selection order, each member's percentage of 100 and the set of
 * members whose percentage is locked against automatic redistribution. Every transition returns a
 * new state; nothing is mutated in place, so a state can be shared freely between threads.</p>
 *
 * <p>Percentages are kept at scale {@value #PERCENT_SCALE} with HALF_UP rounding.</p>
 */
public record SplitState(ParticipantRole role,
                         List<String> selected,
                         Map<String, BigDecimal> percentages,
                         Set<String> locked) {

    public static final int PERCENT_SCALE = 10;
    public static final int MONEY_SCALE = 2;
    public static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * Largest deviation from 100 that {@link #finalize(BigDecimal)} accepts without rescaling
     */
    public static final BigDecimal FINALIZE_TOLERANCE = new BigDecimal("0.1");

    public SplitState {
        if (role == null) {
            throw new IllegalArgumentException("role is required");
        }
        selected = List.copyOf(selected);
        Map<String, BigDecimal> normalized = new LinkedHashMap<>();
        percentages.forEach((memberId, value) -> normalized.put(memberId, scaled(value)));
        percentages = Collections.unmodifiableMap(normalized);
        locked = Collections.unmodifiableSet(new LinkedHashSet<>(locked));
    }

    public static SplitState empty(ParticipantRole role) {
        return new SplitState(role, List.of(), Map.of(), Set.of());
    }

    /**
     * Builds a state directly from a member to percentage map, keeping the map's iteration order
     */
    public static SplitState of(ParticipantRole role, Map<String, BigDecimal> percentages) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        percentages.forEach((memberId, value) -> {
            BigDecimal percentage = value == null ? BigDecimal.ZERO : value;
            if (percentage.signum() < 0 || percentage.compareTo(HUNDRED) > 0) {
                throw new ExpenseValidationException(
                        "Percentage for " + memberId + " must be between 0 and 100, was " + percentage.toPlainString());
            }
            values.put(memberId, percentage);
        });
        return new SplitState(role, new ArrayList<>(values.keySet()), values, Set.of());
    }

    /**
     * Rebuilds the split of an existing expense so it can be edited: each row's amount becomes
     * its percentage of the total.
     */
    public static SplitState fromParticipants(ParticipantRole role, BigDecimal totalAmount,
                                              Collection<Participant> participants) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (Participant participant : participants) {
            if (participant.role() != role) {
                continue;
            }
            BigDecimal percentage = totalAmount.signum() == 0
                    ? BigDecimal.ZERO
                    : participant.individualAmount().multiply(HUNDRED)
                            .divide(totalAmount, PERCENT_SCALE, RoundingMode.HALF_UP);
            values.put(participant.memberId(), percentage);
        }
        return new SplitState(role, new ArrayList<>(values.keySet()), values, Set.of());
    }

    /**
     * Toggles a member in or out of the split.
     *
     * <p>Adding resets every selected member to an equal share of 100, overriding locked values;
     * the lock flags themselves survive and apply to later {@link #setPercentage} calls. Removing
     * drops only that member's percentage and lock, so the remaining values may no longer add up
     * to 100 until the next edit.</p>
     */
    public SplitState select(String memberId) {
        if (selected.contains(memberId)) {
            List<String> nextSelected = new ArrayList<>(selected);
            nextSelected.remove(memberId);
            Map<String, BigDecimal> nextPercentages = new LinkedHashMap<>(percentages);
            nextPercentages.remove(memberId);
            Set<String> nextLocked = new LinkedHashSet<>(locked);
            nextLocked.remove(memberId);
            return new SplitState(role, nextSelected, nextPercentages, nextLocked);
        }

        List<String> nextSelected = new ArrayList<>(selected);
        nextSelected.add(memberId);
        return new SplitState(role, nextSelected, equalShares(nextSelected), locked);
    }

    /**
     * Sets one member's percentage and spreads what is left evenly over the other unlocked members.
     *
     * <p>The value is clamped to {@code [0, 100 - lockedSum]} where lockedSum covers the locked
     * members other than {@code memberId}. If every other member is locked the remainder is left
     * unassigned.</p>
     */
    public SplitState setPercentage(String memberId, BigDecimal value) {
        if (!selected.contains(memberId)) {
            throw new IllegalArgumentException("Member " + memberId + " is not part of the " + role.wireName() + " split");
        }
        BigDecimal lockedSum = lockedSumExcluding(memberId);
        BigDecimal clamped = clamp(value == null ? BigDecimal.ZERO : value, maxFor(lockedSum));
        BigDecimal available = HUNDRED.subtract(lockedSum).subtract(clamped).max(BigDecimal.ZERO);

        List<String> free = selected.stream()
                .filter(id -> !id.equals(memberId) && !locked.contains(id))
                .toList();

        Map<String, BigDecimal> next = new LinkedHashMap<>(percentages);
        next.put(memberId, clamped);
        if (!free.isEmpty()) {
            BigDecimal each = available.divide(BigDecimal.valueOf(free.size()), PERCENT_SCALE, RoundingMode.HALF_UP);
            free.forEach(id -> next.put(id, each));
        }
        return new SplitState(role, selected, next, locked);
    }

    /**
     * Flips a member's lock. No-op for the last unlocked member, who must stay free to absorb
     * redistribution, and for members outside the split.
     */
    public SplitState toggleLock(String memberId) {
        if (!selected.contains(memberId)) {
            return this;
        }
        Set<String> next = new LinkedHashSet<>(locked);
        if (locked.contains(memberId)) {
            next.remove(memberId);
        } else {
            if (isLastUnlocked(memberId)) {
                return this;
            }
            next.add(memberId);
        }
        return new SplitState(role, selected, percentages, next);
    }

    public boolean isLocked(String memberId) {
        return locked.contains(memberId);
    }

    public boolean isLastUnlocked(String memberId) {
        if (locked.contains(memberId)) {
            return false;
        }
        return selected.stream().filter(id -> !locked.contains(id)).count() == 1;
    }

    /**
     * Upper bound a slider for this member may reach given the current locks
     */
    public BigDecimal maxPercentageFor(String memberId) {
        return maxFor(lockedSumExcluding(memberId));
    }

    public BigDecimal percentageOf(String memberId) {
        return percentages.getOrDefault(memberId, BigDecimal.ZERO);
    }

    public BigDecimal total() {
        return selected.stream()
                .map(this::percentageOf)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Turns the split into participant shares of {@code totalAmount}.
     *
     * <p>A split off from 100 by more than {@link #FINALIZE_TOLERANCE} is rescaled and handed back
     * for confirmation instead of being committed. Otherwise each member gets
     * {@code round2(total * pct / 100)}; the cents lost or gained by rounding are booked on the
     * largest share so the shares add up to the total exactly.</p>
     */
    public SplitResult finalize(BigDecimal totalAmount) {
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new ExpenseValidationException("Total amount must be greater than 0");
        }
        if (totalAmount.stripTrailingZeros().scale() > MONEY_SCALE) {
            throw new ExpenseValidationException(
                    "Total amount must not have more than 2 decimal places, was " + totalAmount.toPlainString());
        }
        if (selected.isEmpty()) {
            throw new ExpenseValidationException("Select at least one " + role.wireName());
        }

        BigDecimal sum = total();
        if (sum.signum() == 0) {
            return SplitResult.needsConfirmation(new SplitState(role, selected, equalShares(selected), locked));
        }
        if (sum.subtract(HUNDRED).abs().compareTo(FINALIZE_TOLERANCE) > 0) {
            Map<String, BigDecimal> rescaled = new LinkedHashMap<>();
            for (String memberId : selected) {
                rescaled.put(memberId, percentageOf(memberId).multiply(HUNDRED)
                        .divide(sum, PERCENT_SCALE, RoundingMode.HALF_UP));
            }
            return SplitResult.needsConfirmation(new SplitState(role, selected, rescaled, locked));
        }

        return SplitResult.finalized(this, shares(totalAmount.setScale(MONEY_SCALE)));
    }

    private List<ParticipantShare> shares(BigDecimal totalAmount) {
        List<BigDecimal> amounts = new ArrayList<>(selected.size());
        int largest = 0;
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < selected.size(); i++) {
            BigDecimal percentage = percentageOf(selected.get(i));
            BigDecimal amount = totalAmount.multiply(percentage)
                    .divide(HUNDRED, MONEY_SCALE, RoundingMode.HALF_UP);
            amounts.add(amount);
            allocated = allocated.add(amount);
            if (percentage.compareTo(percentageOf(selected.get(largest))) > 0) {
                largest = i;
            }
        }

        BigDecimal residual = totalAmount.subtract(allocated);
        if (residual.signum() != 0) {
            BigDecimal adjusted = amounts.get(largest).add(residual);
            if (adjusted.signum() >= 0) {
                amounts.set(largest, adjusted);
            }
        }

        List<ParticipantShare> shares = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            shares.add(new ParticipantShare(selected.get(i), role, amounts.get(i)));
        }
        return List.copyOf(shares);
    }

    private BigDecimal lockedSumExcluding(String memberId) {
        return locked.stream()
                .filter(id -> !id.equals(memberId))
                .map(this::percentageOf)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal maxFor(BigDecimal lockedSum) {
        return HUNDRED.subtract(lockedSum).max(BigDecimal.ZERO);
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal max) {
        return value.max(BigDecimal.ZERO).min(max);
    }

    private static Map<String, BigDecimal> equalShares(List<String> members) {
        Map<String, BigDecimal> shares = new LinkedHashMap<>();
        if (members.isEmpty()) {
            return shares;
        }
        BigDecimal each = HUNDRED.divide(BigDecimal.valueOf(members.size()), PERCENT_SCALE, RoundingMode.HALF_UP);
        members.forEach(id -> shares.put(id, each));
        return shares;
    }

    private static BigDecimal scaled(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }
}
