package com.appointments.booking.service;

import com.appointments.booking.service.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Admin login against the single configured credential pair.
 */
@Service
@Slf4j
public class AdminAuthService {

    private final SessionRegistry sessionRegistry;
    private final String adminUsername;
    private final String adminPassword;

    public AdminAuthService(
            SessionRegistry sessionRegistry,
            @Value("${booking.admin.username:}") String adminUsername,
            @Value("${booking.admin.password:}") String adminPassword) {
        this.sessionRegistry = sessionRegistry;
        this.adminUsername = adminUsername;
        this.adminPassword = adminPassword;
    }

    /**
     * @return a new session token, or empty when the credentials do not match
     */
    public Optional<String> login(String username, String password) {
        if (!StringUtils.hasText(adminUsername) || !StringUtils.hasText(adminPassword)) {
            log.warn("Admin login attempted but no admin credentials are configured");
            return Optional.empty();
        }

        if (!matches(adminUsername, username) || !matches(adminPassword, password)) {
            log.warn("Admin login failed for username={}", username);
            return Optional.empty();
        }

        log.info("Admin login succeeded for username={}", username);
        return Optional.of(sessionRegistry.create());
    }

    public void logout(String token) {
        sessionRegistry.revoke(token);
        log.info("Admin logged out");
    }

    public boolean isAuthenticated(String token) {
        return sessionRegistry.isActive(token);
    }

    private static boolean matches(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
