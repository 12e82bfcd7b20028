package com.grouptab.expense.client;

import com.grouptab.expense.client.dto.MemberResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.util.List;

/**
 * Feign client for the group member directory
 * Used for membership checks and display names
 */
@FeignClient(
    name = "member-directory",
    url = "${grouptab.member-directory.url:http://localhost:8082}",
    configuration = MemberDirectoryClientConfig.class,
    fallbackFactory = MemberDirectoryClientFallbackFactory.class
)
public interface MemberDirectoryClient {

    /**
     * All current members of a group
     */
    @GetMapping("/api/v1/groups/{groupId}/members")
    List<MemberResponse> getMembers(@PathVariable("groupId") String groupId);
}
