package com.appointments.booking.dto;

import com.appointments.booking.model.Booking;
import com.appointments.booking.service.notification.MailOutcome;

public record BookingConfirmation(Booking booking, MailOutcome emailOutcome) {

    public boolean emailSent() {
        return emailOutcome == MailOutcome.SENT;
    }
}
