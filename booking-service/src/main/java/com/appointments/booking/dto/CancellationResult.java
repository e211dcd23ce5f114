package com.appointments.booking.dto;

import com.appointments.booking.model.Booking;

/**
 * @param alreadyCanceled true when the booking was canceled before this call and nothing changed
 */
public record CancellationResult(Booking booking, boolean alreadyCanceled) {
}
