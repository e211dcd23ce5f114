package com.appointments.booking.exception;

import com.appointments.booking.constants.ValidationMessages;
import org.springframework.http.HttpStatus;

/**
 * Thrown when no booking matches the given id or cancellation token.
 */
public class BookingNotFoundException extends BookingException {

    private static final String ERROR_CODE = "BOOKING_NOT_FOUND";

    private final String reference;

    public BookingNotFoundException(String reference) {
        super(HttpStatus.NOT_FOUND, ERROR_CODE, ValidationMessages.BOOKING_NOT_FOUND);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
