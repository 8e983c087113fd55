package com.acme.corna.security;

import java.util.UUID;

public record AuthPrincipal(UUID userId, String username, String email) {
}
