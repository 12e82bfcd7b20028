package com.grouptab.expense.client;

import com.grouptab.expense.exception.MemberDirectoryUnavailableException;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.openfeign.FallbackFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fallback for {@link MemberDirectoryClient}.
 *
 * <p>An unknown group (404) reads as a group without members, so membership checks reject the
 * caller. Any other failure fails closed with {@link MemberDirectoryUnavailableException}; the
 * service never guesses membership.</p>
 */
@Slf4j
@Component
public class MemberDirectoryClientFallbackFactory implements FallbackFactory<MemberDirectoryClient> {

    @Override
    public MemberDirectoryClient create(Throwable cause) {
        return groupId -> {
            if (cause instanceof FeignException.NotFound) {
                log.debug("Member directory does not know group {}", groupId);
                return List.of();
            }
            log.warn("Member directory unavailable for group {}: {}", groupId, cause.toString());
            throw new MemberDirectoryUnavailableException(groupId, cause);
        };
    }
}
