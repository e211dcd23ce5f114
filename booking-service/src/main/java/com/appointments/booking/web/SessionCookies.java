package com.appointments.booking.web;

import com.appointments.booking.constants.BookingConstants;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;

public final class SessionCookies {

    private SessionCookies() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String readToken(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, BookingConstants.SESSION_COOKIE);
        return cookie == null ? null : cookie.getValue();
    }

    public static ResponseCookie issue(String token) {
        return base(token).build();
    }

    public static ResponseCookie expire() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private static ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(BookingConstants.SESSION_COOKIE, value)
                .httpOnly(true)
                .path("/")
                .sameSite("Lax");
    }
}
