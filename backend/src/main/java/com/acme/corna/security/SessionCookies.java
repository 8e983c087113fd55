package com.acme.corna.security;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Component
public class SessionCookies {
    private final SessionProperties props;

    public SessionCookies(SessionProperties props) {
        this.props = props;
    }

    public String read(HttpServletRequest request) {
        if (request.getCookies() == null) return null;
        return Arrays.stream(request.getCookies()).filter(c -> c.getName().equals(props.cookieName())).map(Cookie::getValue).findFirst().orElse(null);
    }

    public void write(HttpServletResponse response, String token) {
        ResponseCookie cookie = ResponseCookie.from(props.cookieName(), token)
                .httpOnly(true)
                .secure(props.secureCookie())
                .sameSite("Lax")
                .path("/")
                .maxAge(props.ttl())
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }

    public void clear(HttpServletResponse response) {
        ResponseCookie cookie = ResponseCookie.from(props.cookieName(), "")
                .httpOnly(true)
                .secure(props.secureCookie())
                .sameSite("Lax")
                .path("/")
                .maxAge(0)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
