package com.grouptab.expense.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PaymentStatus")
class PaymentStatusTest {

    @Test
    @DisplayName("Only forward moves are allowed")
    void forwardOnly() {
        assertThat(PaymentStatus.PENDING.canMoveTo(PaymentStatus.SENT)).isTrue();
        assertThat(PaymentStatus.PENDING.canMoveTo(PaymentStatus.COMPLETED)).isTrue();
        assertThat(PaymentStatus.SENT.canMoveTo(PaymentStatus.SENT)).isTrue();
        assertThat(PaymentStatus.SENT.canMoveTo(PaymentStatus.PENDING)).isFalse();
        assertThat(PaymentStatus.COMPLETED.canMoveTo(PaymentStatus.SENT)).isFalse();
    }

    @Test
    @DisplayName("Payers start completed, owers start pending")
    void initialStatus() {
        assertThat(PaymentStatus.initialFor(ParticipantRole.PAYER)).isEqualTo(PaymentStatus.COMPLETED);
        assertThat(PaymentStatus.initialFor(ParticipantRole.OWER)).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("Wire names parse case-insensitively")
    void parsesWireNames() {
        assertThat(PaymentStatus.fromWireName("Sent")).isEqualTo(PaymentStatus.SENT);
        assertThat(PaymentStatus.fromWireName("COMPLETED")).isEqualTo(PaymentStatus.COMPLETED);
        assertThatThrownBy(() -> PaymentStatus.fromWireName("paid"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
