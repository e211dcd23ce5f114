package com.appointments.booking.service.session;

import com.appointments.booking.constants.BookingConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class SessionPurgeScheduler {

    private final SessionRegistry sessionRegistry;

    @Scheduled(fixedDelay = BookingConstants.SESSION_PURGE_INTERVAL_MS)
    public void purgeExpiredSessions() {
        int purged = sessionRegistry.purgeExpired();
        if (purged > 0) {
            log.info("Purged {} expired admin sessions, {} live", purged, sessionRegistry.size());
        }
    }
}
