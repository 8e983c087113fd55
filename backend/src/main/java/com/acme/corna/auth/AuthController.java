package com.acme.corna.auth;

import com.acme.corna.security.SessionCookies;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {
    private final AuthService authService;
    private final LoginAttemptRateLimiter limiter;
    private final SessionCookies cookies;

    public AuthController(AuthService authService, LoginAttemptRateLimiter limiter, SessionCookies cookies) {
        this.authService = authService;
        this.limiter = limiter;
        this.cookies = cookies;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public AuthDtos.UserResponse register(@RequestBody @Valid AuthDtos.RegisterRequest request) {
        return authService.register(request);
    }

    @PostMapping("/login")
    public AuthDtos.UserResponse login(@RequestBody @Valid AuthDtos.LoginRequest request, HttpServletRequest httpRequest, HttpServletResponse response) {
        limiter.checkLogin(httpRequest.getRemoteAddr());
        var result = authService.login(request, cookies.read(httpRequest));
        cookies.write(response, result.token());
        return new AuthDtos.UserResponse(result.user().getUsername());
    }

    @DeleteMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request, HttpServletResponse response) {
        authService.logout(cookies.read(request));
        cookies.clear(response);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/check-login-status")
    public AuthDtos.LoginStatus checkLoginStatus(HttpServletRequest request) {
        return new AuthDtos.LoginStatus(authService.isLoggedIn(cookies.read(request)));
    }
}
