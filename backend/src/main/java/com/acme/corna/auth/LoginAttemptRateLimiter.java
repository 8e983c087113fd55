package com.acme.corna.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counts login attempts per client address in a fixed Redis window.
 */
@Component
public class LoginAttemptRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(LoginAttemptRateLimiter.class);
    static final String KEY_PREFIX = "ratelimit:login:";

    private final StringRedisTemplate redis;
    private final int maxAttempts;
    private final Duration window;

    public LoginAttemptRateLimiter(
            StringRedisTemplate redis,
            @Value("${app.auth.login-rate-limit:20}") int maxAttempts,
            @Value("${app.auth.login-rate-window:PT1M}") Duration window
    ) {
        this.redis = redis;
        this.maxAttempts = maxAttempts;
        this.window = window;
    }

    public void checkLogin(String clientAddress) {
        String key = KEY_PREFIX + clientAddress;
        Long count = redis.opsForValue().increment(key);
        if (count != null && count == 1) {
            redis.expire(key, window);
        }
        if (count != null && count > maxAttempts) {
            log.warn("Login rate limit exceeded for {}", clientAddress);
            throw new IllegalArgumentException("Too many attempts, try again later");
        }
    }
}
