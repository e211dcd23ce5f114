package com.appointments.booking.constants;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final int TOKEN_BYTES = 24;
    public static final int SESSION_TOKEN_BYTES = 32;

    public static final String SESSION_COOKIE = "admin_session";
    public static final long SESSION_PURGE_INTERVAL_MS = 600000;

    public static final int IMPLICIT_TLS_PORT = 465;

    public static final String CANCEL_PATH = "/annulla";
    public static final String ADMIN_PATH = "/admin";
    public static final String ADMIN_LOGIN_PATH = "/admin/login";
    public static final String ADMIN_API_PATH = "/api/bookings";
    public static final String DEFAULT_HOST = "127.0.0.1:8000";
}
