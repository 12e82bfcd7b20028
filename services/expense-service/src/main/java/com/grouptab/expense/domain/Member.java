package com.grouptab.expense.domain;

/**
 * Group member as seen by the expense service. Owned by the group service; read-only here.
 */
public record Member(String id, String displayName) {

    public String label() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return fallbackLabel(id);
    }

    public static String fallbackLabel(String memberId) {
        if (memberId == null) {
            return "Unknown";
        }
        String suffix = memberId.length() > 4 ? memberId.substring(memberId.length() - 4) : memberId;
        return "User " + suffix;
    }
}
