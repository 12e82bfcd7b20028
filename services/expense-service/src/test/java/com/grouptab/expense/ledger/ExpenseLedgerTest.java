package com.grouptab.expense.ledger;

import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.ParticipantShare;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.exception.ExpenseValidationException;
import com.grouptab.expense.exception.NotExpenseCreatorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.grouptab.expense.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("ExpenseLedger")
class ExpenseLedgerTest {

    private final ExpenseLedger ledger = new ExpenseLedger(fixedClock());

    private static ExpenseDraft draft(String description, String total, List<ParticipantShare> shares) {
        return new ExpenseDraft(TEST_GROUP_ID, TEST_EVENT_ID, description, amount(total), ALICE, shares);
    }

    private static ParticipantShare share(String memberId, ParticipantRole role, String amount) {
        return new ParticipantShare(memberId, role, amount(amount));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("Payers start completed and owers start pending")
        void initialStatuses() {
            Expense expense = ledger.create(draft("Dinner", "100", List.of(
                    share(ALICE, ParticipantRole.PAYER, "100"),
                    share(BOB, ParticipantRole.OWER, "60"),
                    share(CAROL, ParticipantRole.OWER, "40"))));

            assertThat(expense.payers()).extracting(Participant::paymentStatus).containsOnly(PaymentStatus.COMPLETED);
            assertThat(expense.owers()).extracting(Participant::paymentStatus).containsOnly(PaymentStatus.PENDING);
            assertThat(expense.createdAt()).isEqualTo(NOW);
            assertThat(expense.updatedAt()).isEqualTo(NOW);
            assertThat(expense.createdBy()).isEqualTo(ALICE);
            assertThat(expense.id()).isNotNull();
        }

        @Test
        @DisplayName("Blank description defaults to Expense")
        void defaultDescription() {
            Expense expense = ledger.create(draft("   ", "10", List.of(
                    share(ALICE, ParticipantRole.PAYER, "10"),
                    share(BOB, ParticipantRole.OWER, "10"))));

            assertThat(expense.description()).isEqualTo("Expense");
        }

        @Test
        @DisplayName("Total with fractions of a cent is rejected")
        void rejectsSubCentTotal() {
            assertThatThrownBy(() -> ledger.create(draft("Taxi", "30.005", List.of(
                    share(ALICE, ParticipantRole.PAYER, "30.005"),
                    share(BOB, ParticipantRole.OWER, "30.005")))))
                    .isInstanceOf(ExpenseValidationException.class)
                    .hasMessageContaining("2 decimal places");
        }

        @Test
        @DisplayName("Member may be payer and ower on the same expense")
        void payerAndOwer() {
            Expense expense = ledger.create(draft("Taxi", "30", List.of(
                    share(ALICE, ParticipantRole.PAYER, "30"),
                    share(ALICE, ParticipantRole.OWER, "10"),
                    share(BOB, ParticipantRole.OWER, "20"))));

            assertThat(expense.participants()).hasSize(3);
        }

        @Test
        @DisplayName("Non-positive total is rejected")
        void rejectsNonPositiveTotal() {
            assertThatThrownBy(() -> ledger.create(draft("x", "0", List.of(
                    share(ALICE, ParticipantRole.PAYER, "0"),
                    share(BOB, ParticipantRole.OWER, "0")))))
                    .isInstanceOf(ExpenseValidationException.class);
        }

        @Test
        @DisplayName("Missing owers are rejected")
        void rejectsMissingOwers() {
            assertThatThrownBy(() -> ledger.create(draft("x", "10", List.of(
                    share(ALICE, ParticipantRole.PAYER, "10")))))
                    .isInstanceOf(ExpenseValidationException.class)
                    .hasMessageContaining("ower");
        }

        @Test
        @DisplayName("Unreconciled role sums are rejected")
        void rejectsUnreconciledSums() {
            assertThatThrownBy(() -> ledger.create(draft("x", "10", List.of(
                    share(ALICE, ParticipantRole.PAYER, "10"),
                    share(BOB, ParticipantRole.OWER, "9.98")))))
                    .isInstanceOf(ExpenseValidationException.class);
        }

        @Test
        @DisplayName("A one cent gap is tolerated")
        void toleratesOneCent() {
            Expense expense = ledger.create(draft("x", "10", List.of(
                    share(ALICE, ParticipantRole.PAYER, "10"),
                    share(BOB, ParticipantRole.OWER, "9.99"))));

            assertThat(expense.roleTotal(ParticipantRole.OWER)).isEqualByComparingTo("9.99");
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("Existing rows keep their payment status, new rows start fresh")
        void keepsStatuses() {
            // given: Bob already paid
            Expense original = ledger.create(draft("Dinner", "100", List.of(
                    share(ALICE, ParticipantRole.PAYER, "100"),
                    share(BOB, ParticipantRole.OWER, "60"),
                    share(CAROL, ParticipantRole.OWER, "40"))));
            Expense paid = original.withParticipants(withStatusFor(original, BOB), original.updatedAt());
            ExpenseLedger later = new ExpenseLedger(Clock.fixed(Instant.parse("2025-03-02T08:00:00Z"), ZoneOffset.UTC));

            // when: Carol is replaced by a new ower
            Expense updated = later.update(paid, "Dinner and drinks", amount("120"), List.of(
                    share(ALICE, ParticipantRole.PAYER, "120"),
                    share(BOB, ParticipantRole.OWER, "60"),
                    share("device-dave-0004", ParticipantRole.OWER, "60")));

            // then
            assertThat(updated.id()).isEqualTo(original.id());
            assertThat(updated.createdAt()).isEqualTo(original.createdAt());
            assertThat(updated.updatedAt()).isEqualTo(Instant.parse("2025-03-02T08:00:00Z"));
            assertThat(updated.description()).isEqualTo("Dinner and drinks");
            assertThat(updated.owers())
                    .extracting(Participant::memberId, Participant::paymentStatus)
                    .containsExactly(
                            tuple(BOB, PaymentStatus.COMPLETED),
                            tuple("device-dave-0004", PaymentStatus.PENDING));
        }

        private List<Participant> withStatusFor(Expense expense, String memberId) {
            return expense.participants().stream()
                    .map(p -> p.matches(memberId, ParticipantRole.OWER) ? p.withPaymentStatus(PaymentStatus.COMPLETED) : p)
                    .toList();
        }
    }

    @Nested
    @DisplayName("delete permission")
    class DeletePermission {

        @Test
        @DisplayName("Only the creator may delete")
        void creatorOnly() {
            Expense expense = dinner();

            assertThat(ledger.canDelete(expense, ALICE)).isTrue();
            assertThat(ledger.canDelete(expense, BOB)).isFalse();
            assertThatCode(() -> ledger.assertCanDelete(expense, ALICE)).doesNotThrowAnyException();
            assertThatThrownBy(() -> ledger.assertCanDelete(expense, BOB))
                    .isInstanceOf(NotExpenseCreatorException.class);
        }
    }
}
