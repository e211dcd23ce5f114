package com.appointments.booking.service.session;

/**
 * Store of live admin session tokens.
 * Kept behind an interface so a shared store can replace the in-process one.
 */
public interface SessionRegistry {

    String create();

    boolean isActive(String token);

    void revoke(String token);

    int purgeExpired();

    int size();
}
