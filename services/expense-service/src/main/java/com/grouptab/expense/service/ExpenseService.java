package com.grouptab.expense.service;

import com.grouptab.expense.balance.BalanceCalculator;
import com.grouptab.expense.balance.UserBalance;
import com.grouptab.expense.client.MemberDirectory;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.MemberLabels;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.dto.BalanceResponse;
import com.grouptab.expense.dto.ExpenseBreakdownResponse;
import com.grouptab.expense.dto.ExpenseRequest;
import com.grouptab.expense.dto.ExpenseResponse;
import com.grouptab.expense.dto.ExpenseSummaryResponse;
import com.grouptab.expense.dto.SimplifiedDebtResponse;
import com.grouptab.expense.dto.UpdatePaymentStatusRequest;
import com.grouptab.expense.entity.ExpenseEntity;
import com.grouptab.expense.events.ExpenseEventPublisher;
import com.grouptab.expense.exception.ExpenseNotFoundException;
import com.grouptab.expense.exception.ExpenseValidationException;
import com.grouptab.expense.exception.ParticipantNotFoundException;
import com.grouptab.expense.exception.SplitNeedsConfirmationException;
import com.grouptab.expense.ledger.ExpenseDraft;
import com.grouptab.expense.ledger.ExpenseLedger;
import com.grouptab.expense.mapper.ExpenseMapper;
import com.grouptab.expense.repository.ExpenseRepository;
import com.grouptab.expense.settlement.DebtSimplifier;
import com.grouptab.expense.settlement.SettlementTracker;
import com.grouptab.expense.settlement.SimplifiedDebt;
import com.grouptab.expense.split.SplitAllocation;
import com.grouptab.expense.split.SplitAllocator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for group expenses: CRUD, payment status, balances and the settlement plan.
 * Every operation first checks that the caller belongs to the group.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class ExpenseService {

    private final ExpenseRepository expenseRepository;
    private final MemberDirectory memberDirectory;
    private final SplitAllocator splitAllocator;
    private final ExpenseLedger expenseLedger;
    private final BalanceCalculator balanceCalculator;
    private final DebtSimplifier debtSimplifier;
    private final SettlementTracker settlementTracker;
    private final ExpenseMapper expenseMapper;
    private final ExpenseEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private Counter expenseCreatedCounter;
    private Counter expenseUpdatedCounter;
    private Counter expenseDeletedCounter;
    private Counter paymentStatusUpdatedCounter;
    private Counter confirmationRequiredCounter;

    @PostConstruct
    public void initMetrics() {
        expenseCreatedCounter = Counter.builder("expense.created")
                .description("Number of expenses created")
                .register(meterRegistry);

        expenseUpdatedCounter = Counter.builder("expense.updated")
                .description("Number of expenses edited")
                .register(meterRegistry);

        expenseDeletedCounter = Counter.builder("expense.deleted")
                .description("Number of expenses deleted")
                .register(meterRegistry);

        paymentStatusUpdatedCounter = Counter.builder("expense.payment_status.updated")
                .description("Number of participant payment status changes")
                .register(meterRegistry);

        confirmationRequiredCounter = Counter.builder("expense.split.confirmation_required")
                .description("Number of submitted splits sent back for confirmation")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public List<ExpenseResponse> listExpenses(String groupId, String eventId, String requesterId) {
        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        List<Expense> expenses = loadExpenses(groupId, eventId);
        log.debug("Listing {} expenses for group {} event {}", expenses.size(), groupId, eventId);
        return expenseMapper.toResponseList(expenses, labels);
    }

    @Transactional(readOnly = true)
    public ExpenseResponse getExpense(String groupId, UUID expenseId, String requesterId) {
        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        return expenseMapper.toResponse(findExpense(groupId, expenseId).toDomain(), labels);
    }

    /**
     * Create an expense from percentage splits
     *
     * @throws SplitNeedsConfirmationException if either role's percentages had to be rescaled;
     *                                         nothing is stored in that case
     */
    public ExpenseResponse createExpense(String groupId, String requesterId, ExpenseRequest request) {
        log.info("Creating expense: group={}, event={}, creator={}, total={}",
                groupId, request.getEventId(), requesterId, request.getTotalAmount());

        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        List<ParticipantShare> shares = allocate(request, labels);

        Expense expense = expenseLedger.create(new ExpenseDraft(
                groupId,
                request.getEventId(),
                request.getDescription(),
                request.getTotalAmount(),
                requesterId,
                shares));

        expenseRepository.save(ExpenseEntity.fromDomain(expense));
        expenseCreatedCounter.increment();
        eventPublisher.publishCreated(expense);

        log.info("Expense created: {}", expense.id());
        return expenseMapper.toResponse(expense, labels);
    }

    /**
     * Replace description, total and splits of an expense. Existing participants keep their
     * payment status.
     */
    public ExpenseResponse updateExpense(String groupId, UUID expenseId, String requesterId, ExpenseRequest request) {
        log.info("Updating expense: {}, group={}, by={}", expenseId, groupId, requesterId);

        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        ExpenseEntity entity = findExpense(groupId, expenseId);
        List<ParticipantShare> shares = allocate(request, labels);

        Expense updated = expenseLedger.update(entity.toDomain(), request.getDescription(), request.getTotalAmount(), shares);
        entity.applyFrom(updated);
        expenseRepository.save(entity);
        expenseUpdatedCounter.increment();
        eventPublisher.publishUpdated(updated, requesterId);

        log.info("Expense updated: {}", expenseId);
        return expenseMapper.toResponse(updated, labels);
    }

    /**
     * Delete an expense with all of its participants. Only the creator may do this.
     */
    public void deleteExpense(String groupId, UUID expenseId, String requesterId) {
        log.info("Deleting expense: {}, group={}, by={}", expenseId, groupId, requesterId);

        memberDirectory.requireMember(groupId, requesterId);
        ExpenseEntity entity = findExpense(groupId, expenseId);
        Expense expense = entity.toDomain();
        expenseLedger.assertCanDelete(expense, requesterId);

        expenseRepository.delete(entity);
        expenseDeletedCounter.increment();
        eventPublisher.publishDeleted(expense, requesterId);

        log.info("Expense deleted: {}", expenseId);
    }

    /**
     * Move one participant row forward. Repeating the current status changes nothing.
     */
    public ExpenseResponse updatePaymentStatus(String groupId, UUID expenseId, String requesterId,
                                               UpdatePaymentStatusRequest request) {
        ParticipantRole role = request.getRole();
        log.info("Updating payment status: expense={}, member={}, role={}, status={}, by={}",
                expenseId, request.getMemberId(), role.wireName(), request.getPaymentStatus().wireName(), requesterId);

        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        ExpenseEntity entity = findExpense(groupId, expenseId);
        Expense existing = entity.toDomain();

        PaymentStatus previous = existing.participants().stream()
                .filter(p -> p.matches(request.getMemberId(), role))
                .map(Participant::paymentStatus)
                .findFirst()
                .orElseThrow(() -> new ParticipantNotFoundException(expenseId, request.getMemberId(), role));

        Expense updated = settlementTracker.withPaymentStatus(existing, request.getMemberId(), role, request.getPaymentStatus());
        if (previous == request.getPaymentStatus()) {
            log.debug("Payment status unchanged for {} on expense {}", request.getMemberId(), expenseId);
            return expenseMapper.toResponse(updated, labels);
        }

        entity.replaceParticipants(updated.participants());
        expenseRepository.save(entity);
        paymentStatusUpdatedCounter.increment();
        eventPublisher.publishPaymentStatusChanged(updated, requesterId, request.getMemberId(), role,
                previous, request.getPaymentStatus());

        log.info("Payment status updated: expense={}, member={}, {} -> {}",
                expenseId, request.getMemberId(), previous.wireName(), request.getPaymentStatus().wireName());
        return expenseMapper.toResponse(updated, labels);
    }

    @Transactional(readOnly = true)
    public BalanceResponse getBalance(String groupId, String eventId, String requesterId) {
        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        UserBalance balance = balanceCalculator.calculate(loadExpenses(groupId, eventId), requesterId);
        return expenseMapper.toBalanceResponse(balance, requesterId, labels);
    }

    /**
     * Fewest pairwise transfers that settle every expense in scope
     */
    @Transactional(readOnly = true)
    public List<SimplifiedDebtResponse> getSettlementPlan(String groupId, String eventId, String requesterId) {
        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        List<SimplifiedDebt> plan = debtSimplifier.simplify(balanceCalculator.obligations(loadExpenses(groupId, eventId)));
        return expenseMapper.toSimplifiedDebtResponseList(plan, labels);
    }

    @Transactional(readOnly = true)
    public ExpenseSummaryResponse getSummary(String groupId, String requesterId) {
        memberDirectory.requireMember(groupId, requesterId);
        return expenseMapper.toSummaryResponse(settlementTracker.summarize(loadExpenses(groupId, null), requesterId));
    }

    @Transactional(readOnly = true)
    public ExpenseBreakdownResponse getBreakdown(String groupId, UUID expenseId, String requesterId) {
        MemberLabels labels = memberDirectory.requireMember(groupId, requesterId);
        Expense expense = findExpense(groupId, expenseId).toDomain();
        return expenseMapper.toBreakdownResponse(balanceCalculator.breakdown(expense, requesterId), labels);
    }

    private List<ParticipantShare> allocate(ExpenseRequest request, MemberLabels labels) {
        requireMembers(request.getPayerPercentages().keySet(), labels);
        requireMembers(request.getOwerPercentages().keySet(), labels);

        SplitAllocation allocation = splitAllocator.allocate(
                request.getTotalAmount(), request.getPayerPercentages(), request.getOwerPercentages());

        if (allocation.needsConfirmation()) {
            confirmationRequiredCounter.increment();
            throw new SplitNeedsConfirmationException(allocation);
        }
        return allocation.shares();
    }

    private static void requireMembers(Iterable<String> memberIds, MemberLabels labels) {
        for (String memberId : memberIds) {
            if (!labels.contains(memberId)) {
                throw new ExpenseValidationException("Member " + memberId + " is not in this group");
            }
        }
    }

    private List<Expense> loadExpenses(String groupId, String eventId) {
        List<ExpenseEntity> entities = eventId == null || eventId.isBlank()
                ? expenseRepository.findByGroupIdOrderByCreatedAtDesc(groupId)
                : expenseRepository.findByGroupIdAndEventIdOrderByCreatedAtDesc(groupId, eventId);
        return entities.stream().map(ExpenseEntity::toDomain).toList();
    }

    private ExpenseEntity findExpense(String groupId, UUID expenseId) {
        return expenseRepository.findByIdAndGroupId(expenseId, groupId)
                .orElseThrow(() -> new ExpenseNotFoundException(expenseId, groupId));
    }
}
