package com.grouptab.expense.mapper;

import com.grouptab.expense.balance.DebtDetail;
import com.grouptab.expense.balance.ExpenseBreakdown;
import com.grouptab.expense.balance.UserBalance;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.MemberLabels;
import com.grouptab.expense.domain.Participant;
import com.grouptab.expense.dto.BalanceResponse;
import com.grouptab.expense.dto.DebtDetailResponse;
import com.grouptab.expense.dto.ExpenseBreakdownResponse;
import com.grouptab.expense.dto.ExpenseResponse;
import com.grouptab.expense.dto.ExpenseSummaryResponse;
import com.grouptab.expense.dto.ParticipantResponse;
import com.grouptab.expense.dto.SimplifiedDebtResponse;
import com.grouptab.expense.settlement.ExpenseSummary;
import com.grouptab.expense.settlement.SettlementTracker;
import com.grouptab.expense.settlement.SimplifiedDebt;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.ReportingPolicy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * MapStruct mapper for expense domain values to response DTOs.
 * Member ids are resolved to display labels through the {@link MemberLabels} context;
 * balance figures are rounded to cents here and nowhere earlier.
 */
@Mapper(
        componentModel = "spring",
        unmappedTargetPolicy = ReportingPolicy.IGNORE,
        imports = SettlementTracker.class
)
public interface ExpenseMapper {

    @Mapping(target = "createdByName", expression = "java(labels.labelFor(expense.createdBy()))")
    @Mapping(target = "fullySettled", expression = "java(SettlementTracker.isFullySettled(expense))")
    @Mapping(target = "progress", expression = "java(SettlementTracker.progress(expense))")
    ExpenseResponse toResponse(Expense expense, @Context MemberLabels labels);

    List<ExpenseResponse> toResponseList(List<Expense> expenses, @Context MemberLabels labels);

    @Mapping(target = "displayName", expression = "java(labels.labelFor(participant.memberId()))")
    ParticipantResponse toParticipantResponse(Participant participant, @Context MemberLabels labels);

    @Mapping(target = "counterpartyName", expression = "java(labels.labelFor(detail.counterparty()))")
    @Mapping(target = "amount", source = "amount", qualifiedByName = "money")
    DebtDetailResponse toDebtDetailResponse(DebtDetail detail, @Context MemberLabels labels);

    @Mapping(target = "userId", source = "userId")
    @Mapping(target = "netBalance", source = "balance.netBalance", qualifiedByName = "money")
    @Mapping(target = "totalOwed", source = "balance.totalOwed", qualifiedByName = "money")
    @Mapping(target = "totalOwing", source = "balance.totalOwing", qualifiedByName = "money")
    @Mapping(target = "detailedDebts", source = "balance.detailedDebts")
    @Mapping(target = "detailedCredits", source = "balance.detailedCredits")
    BalanceResponse toBalanceResponse(UserBalance balance, String userId, @Context MemberLabels labels);

    @Mapping(target = "fromName", expression = "java(labels.labelFor(debt.from()))")
    @Mapping(target = "toName", expression = "java(labels.labelFor(debt.to()))")
    @Mapping(target = "amount", source = "amount", qualifiedByName = "money")
    SimplifiedDebtResponse toSimplifiedDebtResponse(SimplifiedDebt debt, @Context MemberLabels labels);

    List<SimplifiedDebtResponse> toSimplifiedDebtResponseList(List<SimplifiedDebt> debts, @Context MemberLabels labels);

    ExpenseBreakdownResponse toBreakdownResponse(ExpenseBreakdown breakdown, @Context MemberLabels labels);

    @Mapping(target = "activeTotalAmount", source = "activeTotalAmount", qualifiedByName = "money")
    @Mapping(target = "userOwes", source = "userOwes", qualifiedByName = "money")
    @Mapping(target = "userOwed", source = "userOwed", qualifiedByName = "money")
    ExpenseSummaryResponse toSummaryResponse(ExpenseSummary summary);

    @Named("money")
    default BigDecimal money(BigDecimal amount) {
        return amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
    }
}
