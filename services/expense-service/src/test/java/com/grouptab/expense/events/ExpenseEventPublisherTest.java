package com.grouptab.expense.events;

import com.grouptab.expense.config.ExpenseProperties;
import com.grouptab.expense.domain.Expense;
import com.grouptab.expense.domain.ParticipantRole;
import com.grouptab.expense.domain.PaymentStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static com.grouptab.expense.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExpenseEventPublisher")
class ExpenseEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SimpleMeterRegistry meterRegistry;
    private ExpenseProperties properties;
    private ExpenseEventPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new ExpenseProperties();
        publisher = new ExpenseEventPublisher(kafkaTemplate, meterRegistry, properties, fixedClock());
    }

    @Test
    @DisplayName("Publishes a payment status change keyed by expense id")
    void publishesPaymentStatusChange() {
        // given
        Expense expense = dinner();
        CompletableFuture<SendResult<String, Object>> sent = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(sent);

        // when
        publisher.publishPaymentStatusChanged(expense, ALICE, BOB, ParticipantRole.OWER,
                PaymentStatus.PENDING, PaymentStatus.SENT);

        // then
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("group-expense-events"), eq(expense.id().toString()), payload.capture());
        assertThat(payload.getValue()).isInstanceOfSatisfying(ExpenseEvent.class, event -> {
            assertThat(event.getEventType()).isEqualTo(ExpenseEventType.PAYMENT_STATUS_CHANGED);
            assertThat(event.getGroupId()).isEqualTo(TEST_GROUP_ID);
            assertThat(event.getActorId()).isEqualTo(ALICE);
            assertThat(event.getMemberId()).isEqualTo(BOB);
            assertThat(event.getRole()).isEqualTo("ower");
            assertThat(event.getPreviousStatus()).isEqualTo("pending");
            assertThat(event.getPaymentStatus()).isEqualTo("sent");
            assertThat(event.getTimestamp()).isEqualTo(NOW);
        });
        assertThat(meterRegistry.get("expense.events.published").tag("type", "PAYMENT_STATUS_CHANGED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Counts failed sends without throwing")
    void countsFailures() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> publisher.publishCreated(dinner())).doesNotThrowAnyException();
        assertThat(meterRegistry.get("expense.events.failed").tag("type", "EXPENSE_CREATED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Sends nothing when publishing is disabled")
    void disabled() {
        properties.getEvents().setEnabled(false);

        publisher.publishDeleted(dinner(), ALICE);

        verifyNoInteractions(kafkaTemplate);
    }
}
