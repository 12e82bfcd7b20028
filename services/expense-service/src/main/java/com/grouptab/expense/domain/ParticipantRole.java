package com.grouptab.expense.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role a member plays in an expense
 */
public enum ParticipantRole {
    /**
     * Contributed money toward the expense
     */
    PAYER("payer"),

    /**
     * Owes a share of the expense
     */
    OWER("ower");

    private final String wireName;

    ParticipantRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ParticipantRole fromWireName(String value) {
        for (ParticipantRole role : values()) {
            if (role.wireName.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown participant role: " + value);
    }
}
