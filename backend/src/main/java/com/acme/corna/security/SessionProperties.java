package com.acme.corna.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.session")
public record SessionProperties(String secret, String cookieName, Duration ttl, boolean secureCookie) {
}
