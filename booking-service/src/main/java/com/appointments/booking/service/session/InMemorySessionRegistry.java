package com.appointments.booking.service.session;

import com.appointments.booking.util.TokenGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session tokens with a time-to-live and a cap on live sessions.
 * Everything is lost on restart.
 */
@Component
@Slf4j
public class InMemorySessionRegistry implements SessionRegistry {

    private final Map<String, Instant> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;
    private final int maxSessions;

    public InMemorySessionRegistry(
            Clock clock,
            @Value("${booking.session.ttl-minutes:720}") long ttlMinutes,
            @Value("${booking.session.max-sessions:100}") int maxSessions) {
        this.clock = clock;
        this.ttl = Duration.ofMinutes(ttlMinutes);
        this.maxSessions = maxSessions;
    }

    @Override
    public synchronized String create() {
        purgeExpired();
        while (sessions.size() >= maxSessions) {
            evictOldest();
        }

        String token = TokenGenerator.generateSessionToken();
        sessions.put(token, Instant.now(clock));
        log.debug("Session created, {} live", sessions.size());
        return token;
    }

    @Override
    public boolean isActive(String token) {
        if (!StringUtils.hasText(token)) {
            return false;
        }
        Instant issuedAt = sessions.get(token);
        if (issuedAt == null) {
            return false;
        }
        if (isExpired(issuedAt)) {
            sessions.remove(token);
            return false;
        }
        return true;
    }

    @Override
    public void revoke(String token) {
        if (StringUtils.hasText(token) && sessions.remove(token) != null) {
            log.debug("Session revoked, {} live", sessions.size());
        }
    }

    @Override
    public int purgeExpired() {
        int before = sessions.size();
        sessions.values().removeIf(this::isExpired);
        return before - sessions.size();
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private boolean isExpired(Instant issuedAt) {
        return !issuedAt.plus(ttl).isAfter(Instant.now(clock));
    }

    private void evictOldest() {
        sessions.entrySet().stream()
                .min(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .map(Map.Entry::getKey)
                .ifPresent(oldest -> {
                    sessions.remove(oldest);
                    log.info("Session limit of {} reached, evicted oldest session", maxSessions);
                });
    }
}
