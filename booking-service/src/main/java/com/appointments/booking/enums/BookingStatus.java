package com.appointments.booking.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BookingStatus {

    BOOKED("booked"),
    CANCELED("canceled");

    private final String value;

    BookingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static BookingStatus fromValue(String value) {
        for (BookingStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown booking status: " + value);
    }
}
