package com.grouptab.expense.events;

import com.grouptab.expense.config.ExpenseProperties;
import com.grouptab.expense.config.RequestLoggingInterceptor;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import com.grouptab.expense.settlement.SettlementTracker;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes expense change events to Kafka, keyed by expense id.
 * Publishing is best-effort: a failed send is logged and counted, never propagated to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpenseEventPublisher {

    private static final String EVENT_VERSION = "1.0";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final ExpenseProperties properties;
    private final Clock clock;

    public void publishCreated(Expense expense) {
        publish(baseEvent(ExpenseEventType.EXPENSE_CREATED, expense, expense.createdBy()).build());
    }

    public void publishUpdated(Expense expense, String actorId) {
        publish(baseEvent(ExpenseEventType.EXPENSE_UPDATED, expense, actorId).build());
    }

    public void publishDeleted(Expense expense, String actorId) {
        publish(baseEvent(ExpenseEventType.EXPENSE_DELETED, expense, actorId).build());
    }

    public void publishPaymentStatusChanged(Expense expense,
                                            String actorId,
                                            String memberId,
                                            ParticipantRole role,
                                            PaymentStatus previousStatus,
                                            PaymentStatus status) {
        publish(baseEvent(ExpenseEventType.PAYMENT_STATUS_CHANGED, expense, actorId)
                .memberId(memberId)
                .role(role.wireName())
                .previousStatus(previousStatus.wireName())
                .paymentStatus(status.wireName())
                .build());
    }

    CompletableFuture<SendResult<String, Object>> publish(ExpenseEvent event) {
        if (!properties.getEvents().isEnabled()) {
            log.debug("Event publishing disabled, dropping {} for expense {}", event.getEventType(), event.getExpenseId());
            return CompletableFuture.completedFuture(null);
        }

        String topic = properties.getEvents().getTopic();
        try {
            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topic, event.getExpenseId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    meterRegistry.counter("expense.events.published", "type", event.getEventType().name()).increment();
                    log.debug("Published {} for expense {} to {}", event.getEventType(), event.getExpenseId(), topic);
                } else {
                    meterRegistry.counter("expense.events.failed", "type", event.getEventType().name()).increment();
                    log.error("Failed to publish {} for expense {} to {}",
                            event.getEventType(), event.getExpenseId(), topic, ex);
                }
            });
            return future;
        } catch (RuntimeException e) {
            meterRegistry.counter("expense.events.failed", "type", event.getEventType().name()).increment();
            log.error("Failed to publish {} for expense {} to {}", event.getEventType(), event.getExpenseId(), topic, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    private ExpenseEvent.ExpenseEventBuilder baseEvent(ExpenseEventType type, Expense expense, String actorId) {
        return ExpenseEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(type)
                .correlationId(MDC.get(RequestLoggingInterceptor.TRACE_ID))
                .timestamp(clock.instant())
                .version(EVENT_VERSION)
                .expenseId(expense.id().toString())
                .groupId(expense.groupId())
                .eventRef(expense.eventId())
                .actorId(actorId)
                .description(expense.description())
                .totalAmount(expense.totalAmount())
                .fullySettled(SettlementTracker.isFullySettled(expense));
    }
}
