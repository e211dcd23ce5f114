package com.appointments.booking.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

@Getter
public class BookingException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;
    private final Map<String, String> details;

    public BookingException(HttpStatus status, String errorCode, String message) {
        this(status, errorCode, message, null);
    }

    public BookingException(HttpStatus status, String errorCode, String message, Map<String, String> details) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
        this.details = details;
    }
}
