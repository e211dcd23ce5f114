package com.appointments.booking.service.notification;

import com.appointments.booking.model.Booking;

/**
 * Transactional email for bookings. Implementations never throw for delivery problems;
 * the outcome says what happened.
 */
public interface NotificationSender {

    MailOutcome sendConfirmation(Booking booking, String cancelUrl);

    MailOutcome sendThankYou(Booking booking);
}
