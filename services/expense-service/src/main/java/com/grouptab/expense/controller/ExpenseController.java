package com.grouptab.expense.controller;

import com.grouptab.expense.config.RequestLoggingInterceptor;
import com.grouptab.expense.dto.BalanceResponse;
import com.grouptab.expense.dto.ExpenseBreakdownResponse;
import com.grouptab.expense.dto.ExpenseRequest;
import com.grouptab.expense.dto.ExpenseResponse;
import com.grouptab.expense.dto.ExpenseSummaryResponse;
import com.grouptab.expense.dto.SimplifiedDebtResponse;
import com.grouptab.expense.dto.UpdatePaymentStatusRequest;
import com.grouptab.expense.service.ExpenseService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for group expenses. The caller is identified by the {@code X-Member-Id} header.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/groups/{groupId}")
@RequiredArgsConstructor
@Tag(name = "Group Expenses", description = "Expense splitting, balances and settlement APIs")
public class ExpenseController {

    static final String MEMBER_HEADER = RequestLoggingInterceptor.MEMBER_ID_HEADER;

    private final ExpenseService expenseService;

    @GetMapping("/expenses")
    @Operation(summary = "List expenses of a group, newest first")
    public ResponseEntity<List<ExpenseResponse>> listExpenses(
            @PathVariable String groupId,
            @RequestParam(required = false) String eventId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        log.debug("Listing expenses for group: {}, event: {}", groupId, eventId);
        return ResponseEntity.ok(expenseService.listExpenses(groupId, eventId, memberId));
    }

    @GetMapping("/expenses/{expenseId}")
    @Operation(summary = "Get expense details")
    public ResponseEntity<ExpenseResponse> getExpense(
            @PathVariable String groupId,
            @PathVariable UUID expenseId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        log.debug("Fetching expense: {} in group: {}", expenseId, groupId);
        return ResponseEntity.ok(expenseService.getExpense(groupId, expenseId, memberId));
    }

    @PostMapping("/expenses")
    @Operation(summary = "Create an expense from percentage splits")
    public ResponseEntity<ExpenseResponse> createExpense(
            @PathVariable String groupId,
            @RequestHeader(MEMBER_HEADER) String memberId,
            @Valid @RequestBody ExpenseRequest request) {

        log.info("Creating expense in group: {} by member: {}", groupId, memberId);
        ExpenseResponse response = expenseService.createExpense(groupId, memberId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/expenses/{expenseId}")
    @Operation(summary = "Replace an expense's description, total and splits")
    public ResponseEntity<ExpenseResponse> updateExpense(
            @PathVariable String groupId,
            @PathVariable UUID expenseId,
            @RequestHeader(MEMBER_HEADER) String memberId,
            @Valid @RequestBody ExpenseRequest request) {

        log.info("Updating expense: {} in group: {} by member: {}", expenseId, groupId, memberId);
        return ResponseEntity.ok(expenseService.updateExpense(groupId, expenseId, memberId, request));
    }

    @DeleteMapping("/expenses/{expenseId}")
    @Operation(summary = "Delete an expense (creator only)")
    public ResponseEntity<Void> deleteExpense(
            @PathVariable String groupId,
            @PathVariable UUID expenseId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        log.info("Deleting expense: {} in group: {} by member: {}", expenseId, groupId, memberId);
        expenseService.deleteExpense(groupId, expenseId, memberId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/expenses/{expenseId}/payment")
    @Operation(summary = "Set a participant's payment status")
    public ResponseEntity<ExpenseResponse> updatePaymentStatus(
            @PathVariable String groupId,
            @PathVariable UUID expenseId,
            @RequestHeader(MEMBER_HEADER) String memberId,
            @Valid @RequestBody UpdatePaymentStatusRequest request) {

        log.info("Updating payment status on expense: {} for member: {}", expenseId, request.getMemberId());
        return ResponseEntity.ok(expenseService.updatePaymentStatus(groupId, expenseId, memberId, request));
    }

    @GetMapping("/expenses/{expenseId}/breakdown")
    @Operation(summary = "Who owes the caller and whom the caller owes on one expense")
    public ResponseEntity<ExpenseBreakdownResponse> getBreakdown(
            @PathVariable String groupId,
            @PathVariable UUID expenseId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        return ResponseEntity.ok(expenseService.getBreakdown(groupId, expenseId, memberId));
    }

    @GetMapping("/balances")
    @Operation(summary = "Get the caller's balance across the group's expenses")
    public ResponseEntity<BalanceResponse> getBalance(
            @PathVariable String groupId,
            @RequestParam(required = false) String eventId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        log.debug("Calculating balance for member: {} in group: {}", memberId, groupId);
        return ResponseEntity.ok(expenseService.getBalance(groupId, eventId, memberId));
    }

    @GetMapping("/settlements")
    @Operation(summary = "Get the simplified transfer plan for the group")
    public ResponseEntity<List<SimplifiedDebtResponse>> getSettlementPlan(
            @PathVariable String groupId,
            @RequestParam(required = false) String eventId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        return ResponseEntity.ok(expenseService.getSettlementPlan(groupId, eventId, memberId));
    }

    @GetMapping("/expenses-summary")
    @Operation(summary = "Get expense counts and the caller's open amounts")
    public ResponseEntity<ExpenseSummaryResponse> getSummary(
            @PathVariable String groupId,
            @RequestHeader(MEMBER_HEADER) String memberId) {

        return ResponseEntity.ok(expenseService.getSummary(groupId, memberId));
    }
}
