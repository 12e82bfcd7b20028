package com.grouptab.expense.client.dto;

import com.grouptab.expense.domain.Member;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Group member as returned by the member directory
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberResponse {

    private String memberId;

    private String displayName;

    public Member toMember() {
        return new Member(memberId, displayName);
    }
}
