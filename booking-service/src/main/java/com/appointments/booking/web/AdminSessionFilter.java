package com.appointments.booking.web;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.constants.ValidationMessages;
import com.appointments.booking.exception.GlobalExceptionHandler.ErrorResponse;
import com.appointments.booking.service.AdminAuthService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Rejects admin API calls without a live session before the body is read.
 * Every path under the admin API prefix is guarded, including ones no controller maps.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminSessionFilter extends OncePerRequestFilter {

    private static final UrlPathHelper URL_PATH_HELPER = new UrlPathHelper();

    private final AdminAuthService adminAuthService;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        // decoded and without ;parameters, the way the dispatcher matches it
        String path = URL_PATH_HELPER.getPathWithinApplication(request);
        return !path.startsWith(BookingConstants.ADMIN_API_PATH);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (adminAuthService.isAuthenticated(SessionCookies.readToken(request))) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Unauthorized {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(),
                ErrorResponse.of("UNAUTHORIZED", ValidationMessages.UNAUTHORIZED));
    }
}
