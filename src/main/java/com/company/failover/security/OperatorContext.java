package com.company.failover.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * Identity of the operator behind the current request, taken from the JWT.
 * Recorded as triggeredBy on failover events and as the activity actor.
 */
@Component
@Slf4j
public class OperatorContext {

    public static final String ANONYMOUS = "anonymous";

    /**
     * JWT subject, or "anonymous" outside an authenticated request
     */
    public String getCurrentOperatorId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            log.warn("No authenticated operator, recording action as {}", ANONYMOUS);
            return ANONYMOUS;
        }

        if (authentication.getPrincipal() instanceof Jwt jwt) {
            String subject = jwt.getClaimAsString("sub");
            return subject != null ? subject : ANONYMOUS;
        }

        log.warn("Unexpected authentication principal type: {}",
                authentication.getPrincipal().getClass());
        return authentication.getName() != null ? authentication.getName() : ANONYMOUS;
    }
}
