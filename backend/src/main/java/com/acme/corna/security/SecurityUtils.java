package com.acme.corna.security;

import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

public final class SecurityUtils {
    private SecurityUtils() {}

    public static AuthPrincipal principal() {
        return currentPrincipal().orElseThrow(() -> new IllegalArgumentException("Login required for this action"));
    }

    public static Optional<AuthPrincipal> currentPrincipal() {
        var auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !(auth.getPrincipal() instanceof AuthPrincipal p)) {
            return Optional.empty();
        }
        return Optional.of(p);
    }
}
