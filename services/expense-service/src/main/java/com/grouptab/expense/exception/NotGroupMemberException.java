package com.grouptab.expense.exception;

/**
 * Exception thrown when the caller is not a member of the addressed group
 * Results in HTTP 403 Forbidden
 */
public class NotGroupMemberException extends ExpenseException {

    public NotGroupMemberException(String groupId, String memberId) {
        super("NOT_GROUP_MEMBER",
              String.format("Member %s is not a member of group %s", memberId, groupId),
              groupId, memberId);
    }
}
