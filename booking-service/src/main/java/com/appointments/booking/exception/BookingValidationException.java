package com.appointments.booking.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class BookingValidationException extends BookingException {

    public BookingValidationException(String errorCode, String message) {
        super(HttpStatus.BAD_REQUEST, errorCode, message);
    }

    public BookingValidationException(String errorCode, String message, Map<String, String> details) {
        super(HttpStatus.BAD_REQUEST, errorCode, message, details);
    }
}
