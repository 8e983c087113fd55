package com.acme.corna.security;

import com.acme.corna.domain.entity.UserSession;
import com.acme.corna.domain.repo.UserAccountRepository;
import com.acme.corna.domain.repo.UserSessionRepository;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    private final SessionTokenService tokenService;
    private final SessionCookies cookies;
    private final UserSessionRepository sessionRepo;
    private final UserAccountRepository userRepo;

    public SessionAuthenticationFilter(SessionTokenService tokenService, SessionCookies cookies, UserSessionRepository sessionRepo, UserAccountRepository userRepo) {
        this.tokenService = tokenService;
        this.cookies = cookies;
        this.sessionRepo = sessionRepo;
        this.userRepo = userRepo;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
        String token = cookies.read(request);
        if (token != null && !token.isBlank()) {
            try {
                String cookieId = tokenService.cookieId(token);
                resolve(cookieId).ifPresent(principal -> {
                    var authentication = new UsernamePasswordAuthenticationToken(principal, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                });
            } catch (JwtException | IllegalArgumentException e) {
                log.warn("Rejected session cookie from {}: {}", request.getRemoteAddr(), e.getMessage());
                SecurityContextHolder.clearContext();
            }
        }
        filterChain.doFilter(request, response);
    }

    private Optional<AuthPrincipal> resolve(String cookieId) {
        return sessionRepo.findByCookieId(cookieId)
                .filter(s -> s.getExpiresAt().isAfter(Instant.now()))
                .map(UserSession::getUserId)
                .flatMap(userRepo::findById)
                .map(u -> new AuthPrincipal(u.getId(), u.getUsername(), u.getEmail()));
    }
}
