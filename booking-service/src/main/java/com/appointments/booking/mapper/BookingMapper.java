package com.appointments.booking.mapper;

import com.appointments.booking.dto.BookingEntry;
import com.appointments.booking.model.Booking;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

@Component
public class BookingMapper {

    public BookingEntry toEntry(Booking booking) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .id(booking.getId())
                .firstName(booking.getFirstName())
                .lastName(booking.getLastName())
                .phone(booking.getPhone())
                .email(booking.getEmail())
                .dateTime(booking.getDisplayDateTime())
                .date(booking.getBookingDate())
                .time(booking.getBookingTime())
                .note(booking.getNote())
                .status(booking.getStatus().getValue())
                .createdAt(booking.getCreatedAt())
                .canceledAt(booking.getCanceledAt())
                .attended(booking.isAttended())
                .paid(booking.isPaid())
                .thankedAt(booking.getThankedAt())
                .build();
    }

    public List<BookingEntry> toEntries(List<Booking> bookings) {
        return bookings.stream()
                .map(this::toEntry)
                .collect(Collectors.toList());
    }
}
