package com.appointments.booking.service;

import com.appointments.booking.constants.ValidationMessages;
import com.appointments.booking.dto.BookingRequest;
import com.appointments.booking.dto.CancellationResult;
import com.appointments.booking.enums.BookingStatus;
import com.appointments.booking.exception.BookingNotFoundException;
import com.appointments.booking.exception.BookingValidationException;
import com.appointments.booking.exception.SlotUnavailableException;
import com.appointments.booking.model.Booking;
import com.appointments.booking.repository.BookingRepository;
import com.appointments.booking.repository.SqliteConstraints;
import com.appointments.booking.util.TokenGenerator;
import com.appointments.booking.validator.BookingValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Reads and writes bookings. Email is not sent from here; see {@link BookingOrchestrator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingValidator bookingValidator;
    private final Clock clock;

    /**
     * Validates the request and stores a new active booking.
     * The partial unique index on (data, ora) backs up the existence check when two
     * requests race for the same slot.
     */
    @Transactional
    public Booking create(BookingRequest request, boolean requirePrivacy) {
        LocalDate date = bookingValidator.validate(request, requirePrivacy);
        String dateKey = date.toString();
        String time = request.getTime();

        log.info("Creating booking: date={}, time={}", dateKey, time);

        if (bookingRepository.existsByBookingDateAndBookingTimeAndStatus(dateKey, time, BookingStatus.BOOKED)) {
            log.warn("Slot already booked: date={}, time={}", dateKey, time);
            throw new SlotUnavailableException(dateKey, time);
        }

        Booking booking = Booking.builder()
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .phone(request.getPhone())
                .email(request.getEmail())
                .bookingDate(dateKey)
                .bookingTime(time)
                .legacyDateTime(dateKey + " " + time)
                .note(request.getNote() == null ? "" : request.getNote())
                .status(BookingStatus.BOOKED)
                .token(TokenGenerator.generateCancelToken())
                .createdAt(Instant.now(clock))
                .build();

        Booking saved;
        try {
            saved = bookingRepository.saveAndFlush(booking);
        } catch (DataAccessException e) {
            if (!SqliteConstraints.isUniqueViolation(e)) {
                throw e;
            }
            log.warn("Slot taken concurrently: date={}, time={}", dateKey, time);
            throw new SlotUnavailableException(dateKey, time);
        }

        log.info("Booking created: id={}, date={}, time={}", saved.getId(), dateKey, time);
        return saved;
    }

    @Transactional
    public CancellationResult cancelByToken(String token) {
        if (!StringUtils.hasText(token)) {
            throw new BookingValidationException("MISSING_TOKEN", ValidationMessages.TOKEN_REQUIRED);
        }

        Booking booking = bookingRepository.findByToken(token.trim())
                .orElseThrow(() -> new BookingNotFoundException("token"));
        return cancel(booking);
    }

    @Transactional
    public CancellationResult cancelById(Long id) {
        return cancel(findById(id));
    }

    @Transactional
    public void deleteById(Long id) {
        if (!bookingRepository.existsById(id)) {
            throw new BookingNotFoundException(String.valueOf(id));
        }
        bookingRepository.deleteById(id);
        log.info("Booking deleted: id={}", id);
    }

    /**
     * Applies the flags that are present; a null flag leaves the field untouched.
     */
    @Transactional
    public FlagUpdate updateFlags(Long id, Boolean attended, Boolean paid) {
        Booking booking = findById(id);

        if (attended != null) {
            booking.setAttended(attended);
        }
        if (paid != null) {
            booking.setPaid(paid);
        }
        Booking saved = bookingRepository.save(booking);

        // resending attended=true retries a thank-you that failed earlier
        boolean thankYouDue = Boolean.TRUE.equals(attended) && saved.getThankedAt() == null;
        log.info("Booking updated: id={}, attended={}, paid={}, thankYouDue={}",
                id, saved.isAttended(), saved.isPaid(), thankYouDue);
        return new FlagUpdate(saved, thankYouDue);
    }

    /**
     * Records the thank-you email. Only the first call for a booking has any effect.
     */
    public Booking markThanked(Long id) {
        int updated = bookingRepository.markThanked(id, Instant.now(clock));
        if (updated == 0) {
            log.debug("Thank-you already recorded for booking {}", id);
        }
        return findById(id);
    }

    public Booking findById(Long id) {
        if (id == null) {
            throw new BookingValidationException("MISSING_ID", ValidationMessages.ID_REQUIRED);
        }
        return bookingRepository.findById(id)
                .orElseThrow(() -> new BookingNotFoundException(String.valueOf(id)));
    }

    public List<Booking> list() {
        List<Booking> bookings = bookingRepository.findAllInScheduleOrder();
        log.debug("Listing {} bookings", bookings.size());
        return bookings;
    }

    // ============ Private Methods ============

    private CancellationResult cancel(Booking booking) {
        if (booking.isCanceled()) {
            log.info("Booking already canceled: id={}", booking.getId());
            return new CancellationResult(booking, true);
        }

        booking.setStatus(BookingStatus.CANCELED);
        booking.setCanceledAt(Instant.now(clock));
        Booking saved = bookingRepository.save(booking);

        log.info("Booking canceled: id={}, date={}, time={}",
                saved.getId(), saved.getBookingDate(), saved.getBookingTime());
        return new CancellationResult(saved, false);
    }

    public record FlagUpdate(Booking booking, boolean thankYouDue) {
    }
}
