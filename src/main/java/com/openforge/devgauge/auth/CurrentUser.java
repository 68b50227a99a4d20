package com.openforge.devgauge.auth;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The authenticated user id, as put into the SecurityContext by {@link JwtAuthFilter}.
 * Empty outside an authenticated request or a security-propagating executor.
 */
@Component
public class CurrentUser {

    public Optional<String> id() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && auth.getPrincipal() instanceof String id && !id.isBlank()) {
            return Optional.of(id);
        }
        return Optional.empty();
    }

    /** True only when a caller is authenticated and is {@code userId}. */
    public boolean is(String userId) {
        return userId != null && id().map(userId::equals).orElse(false);
    }
}
