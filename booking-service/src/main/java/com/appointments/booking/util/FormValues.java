package com.appointments.booking.util;

import com.appointments.booking.constants.ValidationMessages;
import com.appointments.booking.exception.BookingValidationException;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Parsing helpers for the string values produced by form and JSON bodies.
 */
public final class FormValues {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "on", "yes", "si");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "off", "no");

    private FormValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    public static Optional<Boolean> parseFlag(String field, String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Optional.of(Boolean.FALSE);
        }
        throw new BookingValidationException("INVALID_FLAG", String.format(ValidationMessages.INVALID_FLAG, field));
    }

    /**
     * A consent value counts as given when present and not an explicit negative.
     */
    public static boolean isConsent(String raw) {
        return StringUtils.hasText(raw) && !FALSE_VALUES.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    public static Long parseId(String raw) {
        if (!StringUtils.hasText(raw)) {
            throw new BookingValidationException("MISSING_ID", ValidationMessages.ID_REQUIRED);
        }
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new BookingValidationException("INVALID_ID", ValidationMessages.INVALID_ID);
        }
    }
}
