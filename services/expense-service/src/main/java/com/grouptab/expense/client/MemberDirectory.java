package com.grouptab.expense.client;

import com.grouptab.expense.client.dto.MemberResponse;
import com.grouptab.expense.domain.Member;
import com.grouptab.expense.domain.MemberLabels;
import com.grouptab.expense.exception.ExpenseException;
import com.grouptab.expense.exception.MemberDirectoryUnavailableException;
import com.grouptab.expense.exception.NotGroupMemberException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Membership checks and display labels backed by the member directory
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MemberDirectory {

    private final MemberDirectoryClient memberDirectoryClient;

    public List<Member> membersOf(String groupId) {
        List<MemberResponse> members;
        try {
            members = memberDirectoryClient.getMembers(groupId);
        } catch (ExpenseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemberDirectoryUnavailableException(groupId, e);
        }
        if (members == null) {
            return List.of();
        }
        return members.stream()
                .filter(Objects::nonNull)
                .filter(member -> member.getMemberId() != null)
                .map(MemberResponse::toMember)
                .toList();
    }

    /**
     * Checks that {@code memberId} belongs to the group and returns the group's labels
     *
     * @throws NotGroupMemberException if it does not
     */
    public MemberLabels requireMember(String groupId, String memberId) {
        MemberLabels labels = MemberLabels.of(membersOf(groupId));
        if (memberId == null || !labels.contains(memberId)) {
            log.warn("Rejected member {} for group {}", memberId, groupId);
            throw new NotGroupMemberException(groupId, memberId);
        }
        return labels;
    }
}
