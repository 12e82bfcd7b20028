package com.grouptab.expense.exception;

/**
 * Exception thrown when the member directory cannot be reached
 * Membership checks fail closed, so this results in HTTP 503 Service Unavailable
 */
public class MemberDirectoryUnavailableException extends ExpenseException {

    public MemberDirectoryUnavailableException(String groupId) {
        super("MEMBER_DIRECTORY_UNAVAILABLE", "Member directory unavailable for group: " + groupId, groupId);
    }

    public MemberDirectoryUnavailableException(String groupId, Throwable cause) {
        super("MEMBER_DIRECTORY_UNAVAILABLE", "Member directory unavailable for group: " + groupId, cause);
    }
}
