package com.appointments.booking.validator;

import com.appointments.booking.constants.ValidationMessages;
import com.appointments.booking.dto.BookingRequest;
import com.appointments.booking.exception.BookingValidationException;
import com.appointments.booking.util.FormValues;
import com.appointments.booking.util.SlotCatalog;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Checks a booking request before it reaches the store: required fields, consent,
 * date window and slot membership.
 */
@Component
@Slf4j
public class BookingValidator {

    private final Validator validator;
    private final Clock clock;
    private final int windowDays;

    public BookingValidator(
            Validator validator,
            Clock clock,
            @Value("${booking.window-days:60}") int windowDays) {
        this.validator = validator;
        this.clock = clock;
        this.windowDays = windowDays;
    }

    /**
     * @return the parsed booking date
     */
    public LocalDate validate(BookingRequest request, boolean requirePrivacy) {
        if (request == null) {
            throw new BookingValidationException("MISSING_FIELDS", ValidationMessages.MISSING_FIELDS);
        }

        Map<String, String> missing = new TreeMap<>();
        Set<ConstraintViolation<BookingRequest>> violations = validator.validate(request);
        for (ConstraintViolation<BookingRequest> violation : violations) {
            missing.put(violation.getPropertyPath().toString(), violation.getMessage());
        }
        if (requirePrivacy && !FormValues.isConsent(request.getPrivacy())) {
            missing.put("privacy", ValidationMessages.PRIVACY_REQUIRED);
        }
        if (!missing.isEmpty()) {
            log.debug("Booking request missing fields: {}", missing.keySet());
            throw new BookingValidationException("MISSING_FIELDS", ValidationMessages.MISSING_FIELDS, missing);
        }

        LocalDate date = parseDate(request.getDate());
        validateDateInWindow(date);
        validateTime(request.getTime());
        return date;
    }

    public LocalDate firstBookableDate() {
        return LocalDate.now(clock);
    }

    public LocalDate lastBookableDate() {
        return firstBookableDate().plusDays(windowDays - 1L);
    }

    private LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new BookingValidationException("INVALID_DATE", ValidationMessages.INVALID_DATE);
        }
    }

    private void validateDateInWindow(LocalDate date) {
        if (date.isBefore(firstBookableDate()) || date.isAfter(lastBookableDate())) {
            throw new BookingValidationException("DATE_OUT_OF_RANGE", ValidationMessages.DATE_OUT_OF_RANGE);
        }
    }

    private void validateTime(String time) {
        if (!SlotCatalog.contains(time)) {
            throw new BookingValidationException("INVALID_TIME", ValidationMessages.INVALID_TIME);
        }
    }
}
