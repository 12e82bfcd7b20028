package com.grouptab.expense.book;

import com.grouptab.expense.balance.BalanceCalculator;
import com.grouptab.expense.balance.UserBalance;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.exception.ExpenseNotFoundException;
import com.grouptab.expense.exception.ExpenseValidationException;
import com.grouptab.expense.exception.InvalidPaymentStatusTransitionException;
import com.grouptab.expense.exception.NotExpenseCreatorException;
import com.grouptab.expense.exception.OptimisticUpdateException;
import com.grouptab.expense.ledger.ExpenseDraft;
import com.grouptab.expense.ledger.ExpenseLedger;
import com.grouptab.expense.settlement.DebtSimplifier;
import com.grouptab.expense.settlement.SettlementTracker;
import com.grouptab.expense.settlement.SimplifiedDebt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static com.grouptab.expense.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExpenseBook")
class ExpenseBookTest {

    @Mock
    private ExpenseGateway gateway;

    private ExpenseBook book;
    private Expense dinner;

    @BeforeEach
    void setUp() throws Exception {
        BalanceCalculator balanceCalculator = new BalanceCalculator();
        ExpenseBooks books = new ExpenseBooks(
                new ExpenseLedger(fixedClock()),
                new SettlementTracker(balanceCalculator),
                balanceCalculator,
                new DebtSimplifier());
        book = books.open(TEST_GROUP_ID, TEST_EVENT_ID, gateway);

        dinner = dinner();
        when(gateway.list(TEST_GROUP_ID, TEST_EVENT_ID))
                .thenReturn(CompletableFuture.completedFuture(List.of(dinner)));
        book.refresh().get();
    }

    private static ExpenseDraft taxiDraft() {
        return new ExpenseDraft(TEST_GROUP_ID, TEST_EVENT_ID, "Taxi", amount("30"), BOB, List.of(
                new ParticipantShare(BOB, ParticipantRole.PAYER, amount("30")),
                new ParticipantShare(ALICE, ParticipantRole.OWER, amount("30"))));
    }

    @Test
    @DisplayName("refresh loads the gateway's expenses")
    void refreshLoads() {
        assertThat(book.expenses()).containsExactly(dinner);
        assertThat(book.getGroupId()).isEqualTo(TEST_GROUP_ID);
        assertThat(book.getEventId()).isEqualTo(TEST_EVENT_ID);
    }

    @Test
    @DisplayName("Failed refresh keeps the current list")
    void failedRefreshKeepsList() {
        when(gateway.list(TEST_GROUP_ID, TEST_EVENT_ID))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

        CompletableFuture<List<Expense>> result = book.refresh();

        assertThat(result).isCompletedExceptionally();
        assertThat(book.expenses()).containsExactly(dinner);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("New expense is listed first before the gateway answers")
        void prependsImmediately() throws Exception {
            // given
            CompletableFuture<Expense> pending = new CompletableFuture<>();
            when(gateway.create(any(Expense.class))).thenReturn(pending);

            // when
            CompletableFuture<Expense> result = book.create(taxiDraft());

            // then
            assertThat(book.expenses()).hasSize(2);
            assertThat(book.expenses().get(0).description()).isEqualTo("Taxi");
            assertThat(result).isNotDone();

            pending.complete(book.expenses().get(0));
            assertThat(result.get().createdBy()).isEqualTo(BOB);
            assertThat(book.expenses()).hasSize(2);
        }

        @Test
        @DisplayName("Gateway failure removes the new expense again")
        void rollsBack() {
            when(gateway.create(any(Expense.class)))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

            CompletableFuture<Expense> result = book.create(taxiDraft());

            assertThat(book.expenses()).containsExactly(dinner);
            assertThatThrownBy(result::get)
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(OptimisticUpdateException.class);
        }

        @Test
        @DisplayName("Invalid draft is rejected before reaching the gateway")
        void invalidDraft() {
            ExpenseDraft draft = new ExpenseDraft(TEST_GROUP_ID, TEST_EVENT_ID, "Taxi", amount("0"), BOB, List.of());

            assertThatThrownBy(() -> book.create(draft)).isInstanceOf(ExpenseValidationException.class);
            verify(gateway, never()).create(any());
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("Edited values replace the expense in place")
        void replacesInPlace() throws Exception {
            when(gateway.update(any(Expense.class))).thenAnswer(inv -> CompletableFuture.completedFuture(inv.getArgument(0)));

            Expense updated = book.update(dinner.id(), "Team dinner", amount("100"), List.of(
                    new ParticipantShare(ALICE, ParticipantRole.PAYER, amount("100")),
                    new ParticipantShare(BOB, ParticipantRole.OWER, amount("50")),
                    new ParticipantShare(CAROL, ParticipantRole.OWER, amount("50")))).get();

            assertThat(updated.description()).isEqualTo("Team dinner");
            assertThat(book.expenses()).singleElement()
                    .satisfies(e -> assertThat(e.owers()).extracting(Participant::individualAmount)
                            .usingElementComparator(BigDecimal::compareTo)
                            .containsExactly(amount("50"), amount("50")));
        }

        @Test
        @DisplayName("Unknown expense id is reported synchronously")
        void unknownExpense() {
            UUID unknown = UUID.randomUUID();

            assertThatThrownBy(() -> book.update(unknown, "x", amount("1"), List.of()))
                    .isInstanceOf(ExpenseNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("Creator removes the expense")
        void creatorDeletes() throws Exception {
            when(gateway.delete(TEST_GROUP_ID, dinner.id())).thenReturn(CompletableFuture.completedFuture(null));

            book.delete(dinner.id(), ALICE).get();

            assertThat(book.expenses()).isEmpty();
        }

        @Test
        @DisplayName("Other members cannot delete")
        void nonCreatorRejected() {
            assertThatThrownBy(() -> book.delete(dinner.id(), BOB))
                    .isInstanceOf(NotExpenseCreatorException.class);
            assertThat(book.expenses()).containsExactly(dinner);
            verify(gateway, never()).delete(anyString(), any());
        }

        @Test
        @DisplayName("Gateway failure restores the deleted expense")
        void rollsBack() {
            when(gateway.delete(TEST_GROUP_ID, dinner.id()))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

            CompletableFuture<Void> result = book.delete(dinner.id(), ALICE);

            assertThat(result).isCompletedExceptionally();
            assertThat(book.expenses()).containsExactly(dinner);
        }
    }

    @Nested
    @DisplayName("setPaymentStatus")
    class SetPaymentStatus {

        @Test
        @DisplayName("Status change is applied locally and sent to the gateway")
        void appliesAndPersists() throws Exception {
            when(gateway.updatePaymentStatus(TEST_GROUP_ID, dinner.id(), BOB, ParticipantRole.OWER, PaymentStatus.SENT))
                    .thenReturn(CompletableFuture.completedFuture(null));

            Expense updated = book.setPaymentStatus(dinner.id(), BOB, ParticipantRole.OWER, PaymentStatus.SENT).get();

            assertThat(updated.owers())
                    .filteredOn(p -> p.memberId().equals(BOB))
                    .extracting(Participant::paymentStatus)
                    .containsExactly(PaymentStatus.SENT);
            assertThat(book.expenses()).containsExactly(updated);
        }

        @Test
        @DisplayName("Gateway failure restores the previous status")
        void rollsBack() {
            when(gateway.updatePaymentStatus(TEST_GROUP_ID, dinner.id(), BOB, ParticipantRole.OWER, PaymentStatus.COMPLETED))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("offline")));

            CompletableFuture<Expense> result =
                    book.setPaymentStatus(dinner.id(), BOB, ParticipantRole.OWER, PaymentStatus.COMPLETED);

            assertThat(result).isCompletedExceptionally();
            assertThat(book.expenses()).containsExactly(dinner);
        }

        @Test
        @DisplayName("Backward transition never reaches the gateway")
        void backwardTransition() {
            assertThatThrownBy(() -> book.setPaymentStatus(dinner.id(), ALICE, ParticipantRole.PAYER, PaymentStatus.PENDING))
                    .isInstanceOf(InvalidPaymentStatusTransitionException.class);
            verify(gateway, never()).updatePaymentStatus(any(), any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("derived views")
    class DerivedViews {

        @Test
        @DisplayName("Balance and plan are computed from the local list")
        void balanceAndPlan() {
            UserBalance alice = book.balanceFor(ALICE);
            List<SimplifiedDebt> plan = book.settlementPlan();

            assertThat(alice.netBalance()).isEqualByComparingTo("100");
            assertThat(plan).extracting(SimplifiedDebt::from).containsExactlyInAnyOrder(BOB, CAROL);
            assertThat(plan).extracting(SimplifiedDebt::to).containsOnly(ALICE);
        }

        @Test
        @DisplayName("Dinner counts as settled because its payer row is completed")
        void activeExpenses() {
            assertThat(book.activeExpenses()).isEmpty();
            assertThat(book.summaryFor(ALICE).expenseCount()).isEqualTo(1);
        }
    }
}
