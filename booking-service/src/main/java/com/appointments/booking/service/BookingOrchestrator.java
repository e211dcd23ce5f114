package com.appointments.booking.service;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.dto.BookingConfirmation;
import com.appointments.booking.dto.BookingRequest;
import com.appointments.booking.dto.BookingUpdateResult;
import com.appointments.booking.model.Booking;
import com.appointments.booking.service.notification.MailOutcome;
import com.appointments.booking.service.notification.NotificationSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Pairs booking writes with their emails. Mail goes out after the write has committed,
 * and a delivery problem never undoes or fails the write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingOrchestrator {

    private final BookingService bookingService;
    private final NotificationSender notificationSender;

    public BookingConfirmation book(BookingRequest request, boolean requirePrivacy, String baseUrl) {
        Booking booking = bookingService.create(request, requirePrivacy);

        String cancelUrl = baseUrl + BookingConstants.CANCEL_PATH + "?token=" + booking.getToken();
        MailOutcome outcome = notificationSender.sendConfirmation(booking, cancelUrl);
        if (outcome == MailOutcome.FAILED) {
            log.warn("Booking {} stored without confirmation email", booking.getId());
        }
        return new BookingConfirmation(booking, outcome);
    }

    /**
     * Updates attended/paid. The first time a booking is marked attended a thank-you email is
     * attempted; thanked_at is only recorded when it was actually sent, so a later update retries.
     */
    public BookingUpdateResult update(Long id, Boolean attended, Boolean paid) {
        BookingService.FlagUpdate update = bookingService.updateFlags(id, attended, paid);
        Booking booking = update.booking();

        if (!update.thankYouDue()) {
            return new BookingUpdateResult(booking, false);
        }

        MailOutcome outcome = notificationSender.sendThankYou(booking);
        if (outcome != MailOutcome.SENT) {
            log.info("Thank-you email not sent for booking {}: {}", id, outcome);
            return new BookingUpdateResult(booking, false);
        }

        return new BookingUpdateResult(bookingService.markThanked(id), true);
    }
}
