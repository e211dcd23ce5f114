package com.appointments.booking.exception;

import com.appointments.booking.constants.ValidationMessages;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Thrown when the requested date and time already hold an active booking.
 */
public class SlotUnavailableException extends BookingException {

    private static final String ERROR_CODE = "SLOT_UNAVAILABLE";

    public SlotUnavailableException(String date, String time) {
        super(HttpStatus.CONFLICT, ERROR_CODE, ValidationMessages.SLOT_UNAVAILABLE,
                Map.of("data", date, "ora", time));
    }
}
