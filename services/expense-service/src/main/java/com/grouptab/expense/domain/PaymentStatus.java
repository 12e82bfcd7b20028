package com.grouptab.expense.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-participant payment status. Declaration order is the only allowed direction of travel.
 */
public enum PaymentStatus {
    PENDING("pending"),
    SENT("sent"),
    COMPLETED("completed");

    private final String wireName;

    PaymentStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * True when moving from this status to {@code target} does not go backwards.
     * Re-applying the current status counts as allowed.
     */
    public boolean canMoveTo(PaymentStatus target) {
        return target.ordinal() >= this.ordinal();
    }

    /**
     * Status a freshly created row starts in: payers fronted the money already, owers still owe.
     */
    public static PaymentStatus initialFor(ParticipantRole role) {
        return role == ParticipantRole.PAYER ? COMPLETED : PENDING;
    }

    @JsonCreator
    public static PaymentStatus fromWireName(String value) {
        for (PaymentStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown payment status: " + value);
    }
}
