package com.acme.corna.auth;

import com.acme.corna.domain.entity.UserAccount;
import com.acme.corna.domain.entity.UserSession;
import com.acme.corna.domain.repo.UserAccountRepository;
import com.acme.corna.domain.repo.UserSessionRepository;
import com.acme.corna.media.AvatarService;
import com.acme.corna.security.SessionProperties;
import com.acme.corna.security.SessionTokenService;
import io.jsonwebtoken.JwtException;
import jakarta.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final UserAccountRepository userRepo;
    private final UserSessionRepository sessionRepo;
    private final PasswordEncoder passwordEncoder;
    private final SessionTokenService tokenService;
    private final SessionProperties sessionProperties;
    private final AvatarService avatarService;

    @Value("${app.auth.max-failed-login:5}")
    private int maxFailedLogin;

    @Value("${app.auth.lock-minutes:15}")
    private int lockMinutes;

    public AuthService(UserAccountRepository userRepo, UserSessionRepository sessionRepo, PasswordEncoder passwordEncoder,
                       SessionTokenService tokenService, SessionProperties sessionProperties, AvatarService avatarService) {
        this.userRepo = userRepo;
        this.sessionRepo = sessionRepo;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.sessionProperties = sessionProperties;
        this.avatarService = avatarService;
    }

    @Transactional
    public AuthDtos.UserResponse register(AuthDtos.RegisterRequest request) {
        String email = request.emailAddress().trim().toLowerCase();
        userRepo.findByEmail(email).ifPresent(it -> { throw new IllegalArgumentException("Email address already has an account"); });
        String username = request.userName().trim();
        if (userRepo.existsByUsername(username)) {
            throw new IllegalArgumentException("Username already taken");
        }
        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setUsername(username);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFailedLoginCount(0);
        avatarService.randomAvatar().ifPresent(avatar -> user.setAvatarMediaId(avatar.getId()));
        userRepo.save(user);
        log.info("Registered user {}", username);
        return new AuthDtos.UserResponse(user.getUsername());
    }

    @Transactional(noRollbackFor = IllegalArgumentException.class)
    public LoginResult login(AuthDtos.LoginRequest request, String existingToken) {
        UserAccount user = userRepo.findByEmail(request.emailAddress().trim().toLowerCase())
                .orElseThrow(() -> new EntityNotFoundException("User does not exist"));
        if (user.getLockedUntil() != null && user.getLockedUntil().isAfter(Instant.now())) {
            throw new IllegalArgumentException("Account is locked, try again later");
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            user.setFailedLoginCount(user.getFailedLoginCount() + 1);
            if (user.getFailedLoginCount() >= maxFailedLogin) {
                user.setLockedUntil(Instant.now().plus(Duration.ofMinutes(lockMinutes)));
                user.setFailedLoginCount(0);
                log.warn("Locked account {} after repeated failed logins", user.getUsername());
            }
            throw new IllegalArgumentException("Wrong password");
        }

        user.setFailedLoginCount(0);
        user.setLockedUntil(null);

        cookieId(existingToken).ifPresent(sessionRepo::deleteByCookieId);
        sessionRepo.deleteByUserId(user.getId());
        sessionRepo.flush();

        Instant expiresAt = Instant.now().plus(sessionProperties.ttl());
        UserSession session = new UserSession();
        session.setCookieId(newCookieId());
        session.setUserId(user.getId());
        session.setExpiresAt(expiresAt);
        sessionRepo.save(session);
        log.info("User {} logged in", user.getUsername());
        return new LoginResult(tokenService.issue(session.getCookieId(), expiresAt), user);
    }

    @Transactional
    public void logout(String token) {
        cookieId(token).ifPresent(sessionRepo::deleteByCookieId);
    }

    public boolean isLoggedIn(String token) {
        return cookieId(token)
                .flatMap(sessionRepo::findByCookieId)
                .filter(s -> s.getExpiresAt().isAfter(Instant.now()))
                .isPresent();
    }

    private Optional<String> cookieId(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        try {
            return Optional.of(tokenService.cookieId(token));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring unusable session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String newCookieId() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public record LoginResult(String token, UserAccount user) {}
}
