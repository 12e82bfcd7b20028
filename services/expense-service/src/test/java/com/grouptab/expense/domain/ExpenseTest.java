package com.grouptab.expense.domain;

import com.grouptab.expense.exception.ExpenseValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.grouptab.expense.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("Expense")
class ExpenseTest {

    private static Expense build(String total, Participant... participants) {
        return new Expense(UUID.randomUUID(), TEST_GROUP_ID, null, "Dinner", amount(total), ALICE, NOW, NOW,
                List.of(participants));
    }

    @Test
    @DisplayName("Role views split participants by role")
    void roleViews() {
        Expense expense = dinner();

        assertThat(expense.payers()).extracting(Participant::memberId).containsExactly(ALICE);
        assertThat(expense.owers()).extracting(Participant::memberId).containsExactly(BOB, CAROL);
        assertThat(expense.roleTotal(ParticipantRole.OWER)).isEqualByComparingTo("100");
        assertThat(expense.isCreatedBy(ALICE)).isTrue();
        assertThat(expense.isCreatedBy(BOB)).isFalse();
    }

    @Test
    @DisplayName("Duplicate member within one role is rejected")
    void rejectsDuplicateMember() {
        assertThatThrownBy(() -> build("20", payer(ALICE, "20"), ower(BOB, "10"), ower(BOB, "10")))
                .isInstanceOf(ExpenseValidationException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    @DisplayName("Same member may pay and owe on one expense")
    void allowsPayerAndOwer() {
        Expense expense = build("30", payer(ALICE, "30"), ower(ALICE, "10"), ower(BOB, "20"));

        assertThat(expense.participants()).hasSize(3);
    }

    @Test
    @DisplayName("Role amounts must reconcile with the total")
    void rejectsUnreconciledRole() {
        assertThatThrownBy(() -> build("30", payer(ALICE, "30"), ower(BOB, "25")))
                .isInstanceOf(ExpenseValidationException.class)
                .hasMessageContaining("ower amounts sum to 25");
    }
}
