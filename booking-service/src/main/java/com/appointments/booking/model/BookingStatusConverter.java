package com.appointments.booking.model;

import com.appointments.booking.enums.BookingStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class BookingStatusConverter implements AttributeConverter<BookingStatus, String> {

    @Override
    public String convertToDatabaseColumn(BookingStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public BookingStatus convertToEntityAttribute(String value) {
        // the migration backfills nulls, but rows written by other tools may still carry one
        return value == null ? BookingStatus.BOOKED : BookingStatus.fromValue(value);
    }
}
