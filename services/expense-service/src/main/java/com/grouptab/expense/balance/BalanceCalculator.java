package com.grouptab.expense.balance;

import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Aggregates a user's position across expenses by proportional attribution.
 *
 * <p>On each expense the user's paid amount, as a fraction of everything paid, claims that
 * fraction of every ower's share; the user's owed amount, as a fraction of everything owed,
 * is owed against that fraction of every payer's contribution. Both directions run
 * independently, so a member who is payer and ower on one expense accrues both a credit and a
 * debt for it. A zero denominator skips the branch rather than dividing.</p>
 *
 * <p>Stateless; safe to call concurrently.</p>
 */
@Component
public class BalanceCalculator {

    static final int WORK_SCALE = 10;

    public UserBalance calculate(Collection<Expense> expenses, String userId) {
        BigDecimal totalOwed = BigDecimal.ZERO;
        BigDecimal totalOwing = BigDecimal.ZERO;
        List<DebtDetail> debts = new ArrayList<>();
        List<DebtDetail> credits = new ArrayList<>();

        for (Expense expense : expenses) {
            for (DebtDetail credit : creditsFor(expense, userId)) {
                totalOwed = totalOwed.add(credit.amount());
                credits.add(credit);
            }
            for (DebtDetail debt : debtsFor(expense, userId)) {
                totalOwing = totalOwing.add(debt.amount());
                debts.add(debt);
            }
        }

        return new UserBalance(totalOwed.subtract(totalOwing), totalOwed, totalOwing, debts, credits);
    }

    public ExpenseBreakdown breakdown(Expense expense, String userId) {
        return new ExpenseBreakdown(
                expense.id(),
                creditsFor(expense, userId).stream().filter(d -> d.amount().signum() > 0).toList(),
                debtsFor(expense, userId).stream().filter(d -> d.amount().signum() > 0).toList());
    }

    /**
     * Every ower-to-payer obligation in the given expenses, attributed the same way as
     * {@link #calculate}: each ower owes each payer its share scaled by that payer's part of
     * the total paid.
     */
    public List<Obligation> obligations(Collection<Expense> expenses) {
        List<Obligation> obligations = new ArrayList<>();
        for (Expense expense : expenses) {
            BigDecimal totalPaid = expense.roleTotal(ParticipantRole.PAYER);
            if (totalPaid.signum() == 0) {
                continue;
            }
            for (Participant ower : expense.owers()) {
                for (Participant payer : expense.payers()) {
                    BigDecimal amount = ower.individualAmount()
                            .multiply(payer.individualAmount())
                            .divide(totalPaid, WORK_SCALE, RoundingMode.HALF_UP);
                    if (amount.signum() > 0) {
                        obligations.add(new Obligation(ower.memberId(), payer.memberId(), amount));
                    }
                }
            }
        }
        return obligations;
    }

    private List<DebtDetail> creditsFor(Expense expense, String userId) {
        BigDecimal userPaid = amountFor(expense, userId, ParticipantRole.PAYER);
        BigDecimal totalPaid = expense.roleTotal(ParticipantRole.PAYER);
        if (userPaid.signum() <= 0 || totalPaid.signum() == 0) {
            return List.of();
        }

        List<DebtDetail> credits = new ArrayList<>();
        for (Participant ower : expense.owers()) {
            BigDecimal owed = ower.individualAmount()
                    .multiply(userPaid)
                    .divide(totalPaid, WORK_SCALE, RoundingMode.HALF_UP);
            credits.add(new DebtDetail(expense.id(), expense.description(), ower.memberId(), owed));
        }
        return credits;
    }

    private List<DebtDetail> debtsFor(Expense expense, String userId) {
        BigDecimal userOwes = amountFor(expense, userId, ParticipantRole.OWER);
        BigDecimal totalOwedOnExpense = expense.roleTotal(ParticipantRole.OWER);
        if (userOwes.signum() <= 0 || totalOwedOnExpense.signum() == 0) {
            return List.of();
        }

        List<DebtDetail> debts = new ArrayList<>();
        for (Participant payer : expense.payers()) {
            BigDecimal owing = payer.individualAmount()
                    .multiply(userOwes)
                    .divide(totalOwedOnExpense, WORK_SCALE, RoundingMode.HALF_UP);
            debts.add(new DebtDetail(expense.id(), expense.description(), payer.memberId(), owing));
        }
        return debts;
    }

    private static BigDecimal amountFor(Expense expense, String userId, ParticipantRole role) {
        return expense.participants().stream()
                .filter(p -> p.role() == role && p.memberId().equals(userId))
                .map(Participant::individualAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
