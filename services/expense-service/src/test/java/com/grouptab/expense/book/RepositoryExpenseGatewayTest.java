package com.grouptab.expense.book;

import com.grouptab.expense.balance.BalanceCalculator;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.entity.ExpenseEntity;
import com.grouptab.expense.exception.ExpenseNotFoundException;
import com.grouptab.expense.ledger.ExpenseDraft;
import com.grouptab.expense.ledger.ExpenseLedger;
import com.grouptab.expense.repository.ExpenseRepository;
import com.grouptab.expense.settlement.DebtSimplifier;
import com.grouptab.expense.settlement.SettlementTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.grouptab.expense.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RepositoryExpenseGateway")
class RepositoryExpenseGatewayTest {

    @Mock
    private ExpenseRepository expenseRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SettlementTracker settlementTracker;
    private RepositoryExpenseGateway gateway;

    @BeforeEach
    void setUp() {
        settlementTracker = new SettlementTracker(new BalanceCalculator());
        gateway = new RepositoryExpenseGateway(expenseRepository, settlementTracker,
                new TransactionTemplate(transactionManager), Runnable::run);
    }

    @Test
    @DisplayName("Lists a whole group or one event, mapped to domain expenses")
    void listsByGroupOrEvent() {
        // given
        Expense dinner = dinner();
        when(expenseRepository.findByGroupIdOrderByCreatedAtDesc(TEST_GROUP_ID))
                .thenReturn(List.of(ExpenseEntity.fromDomain(dinner)));
        when(expenseRepository.findByGroupIdAndEventIdOrderByCreatedAtDesc(TEST_GROUP_ID, TEST_EVENT_ID))
                .thenReturn(List.of());

        // when
        List<Expense> all = gateway.list(TEST_GROUP_ID, null).join();
        List<Expense> event = gateway.list(TEST_GROUP_ID, TEST_EVENT_ID).join();

        // then
        assertThat(all).singleElement().isEqualTo(dinner);
        assertThat(event).isEmpty();
        verify(transactionManager, times(2)).commit(any());
    }

    @Test
    @DisplayName("Moves the stored row and re-checks the transition")
    void updatesPaymentStatus() {
        // given
        Expense dinner = dinner();
        ExpenseEntity stored = ExpenseEntity.fromDomain(dinner);
        when(expenseRepository.findByIdAndGroupId(dinner.id(), TEST_GROUP_ID)).thenReturn(Optional.of(stored));

        // when
        gateway.updatePaymentStatus(TEST_GROUP_ID, dinner.id(), BOB, ParticipantRole.OWER, PaymentStatus.SENT).join();

        // then
        verify(expenseRepository).save(stored);
        assertThat(stored.toDomain().participants())
                .filteredOn(p -> p.matches(BOB, ParticipantRole.OWER))
                .singleElement()
                .extracting(p -> p.paymentStatus())
                .isEqualTo(PaymentStatus.SENT);
    }

    @Test
    @DisplayName("Unknown expense fails the future and deletes nothing")
    void unknownExpense() {
        UUID id = UUID.randomUUID();
        when(expenseRepository.findByIdAndGroupId(id, TEST_GROUP_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gateway.delete(TEST_GROUP_ID, id).join())
                .hasCauseInstanceOf(ExpenseNotFoundException.class);
        verify(expenseRepository, never()).delete(any(ExpenseEntity.class));
    }

    @Test
    @DisplayName("A book backed by the store keeps the ids it assigned")
    void backsAnExpenseBook() {
        // given
        ExpenseBooks books = new ExpenseBooks(new ExpenseLedger(fixedClock()), settlementTracker,
                new BalanceCalculator(), new DebtSimplifier());
        ExpenseBook book = books.open(TEST_GROUP_ID, TEST_EVENT_ID, gateway);
        ExpenseDraft draft = new ExpenseDraft(TEST_GROUP_ID, TEST_EVENT_ID, "Taxi", amount("30"), BOB, List.of(
                new ParticipantShare(BOB, ParticipantRole.PAYER, amount("30")),
                new ParticipantShare(ALICE, ParticipantRole.OWER, amount("30"))));

        // when
        Expense created = book.create(draft).join();

        // then
        ArgumentCaptor<ExpenseEntity> saved = ArgumentCaptor.forClass(ExpenseEntity.class);
        verify(expenseRepository).save(saved.capture());
        assertThat(saved.getValue().getId()).isEqualTo(created.id());
        assertThat(saved.getValue().toDomain()).isEqualTo(created);
        assertThat(book.expenses()).containsExactly(created);
    }
}
