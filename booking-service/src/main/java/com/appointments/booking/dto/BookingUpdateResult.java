package com.appointments.booking.dto;

import com.appointments.booking.model.Booking;

public record BookingUpdateResult(Booking booking, boolean thankYouSent) {
}
