package com.appointments.booking.util;

import com.appointments.booking.constants.BookingConstants;

import java.security.SecureRandom;
import java.util.Base64;

public final class TokenGenerator {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private TokenGenerator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String generateCancelToken() {
        return randomToken(BookingConstants.TOKEN_BYTES);
    }

    public static String generateSessionToken() {
        return randomToken(BookingConstants.SESSION_TOKEN_BYTES);
    }

    private static String randomToken(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return ENCODER.encodeToString(buffer);
    }
}
