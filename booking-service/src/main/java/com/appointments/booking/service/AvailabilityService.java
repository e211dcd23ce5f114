package com.appointments.booking.service;

import com.appointments.booking.dto.AvailabilityResponse;
import com.appointments.booking.dto.DayAvailability;
import com.appointments.booking.enums.BookingStatus;
import com.appointments.booking.model.Booking;
import com.appointments.booking.repository.BookingRepository;
import com.appointments.booking.util.DateLabels;
import com.appointments.booking.util.SlotCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Free slots per day over a rolling window starting today. Computed on every call.
 */
@Service
@Slf4j
public class AvailabilityService {

    private final BookingRepository bookingRepository;
    private final Clock clock;
    private final int windowDays;

    public AvailabilityService(
            BookingRepository bookingRepository,
            Clock clock,
            @Value("${booking.window-days:60}") int windowDays) {
        this.bookingRepository = bookingRepository;
        this.clock = clock;
        this.windowDays = windowDays;
    }

    public AvailabilityResponse getAvailability() {
        return getAvailability(windowDays);
    }

    public AvailabilityResponse getAvailability(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Availability window must cover at least one day");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate last = today.plusDays(days - 1L);

        Map<String, Set<String>> bookedByDate = new HashMap<>();
        for (Booking booking : bookingRepository.findScheduledBetween(
                BookingStatus.BOOKED, today.toString(), last.toString())) {
            bookedByDate.computeIfAbsent(booking.getBookingDate(), k -> new HashSet<>())
                    .add(booking.getBookingTime());
        }

        List<DayAvailability> dates = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            LocalDate day = today.plusDays(i);
            String key = day.toString();
            Set<String> taken = bookedByDate.getOrDefault(key, Collections.emptySet());
            List<String> available = SlotCatalog.slots().stream()
                    .filter(slot -> !taken.contains(slot))
                    .collect(Collectors.toList());
            dates.add(new DayAvailability(key, DateLabels.shortLabel(day), available));
        }

        log.debug("Availability computed: {} days from {}, {} days with bookings",
                days, today, bookedByDate.size());

        return AvailabilityResponse.builder()
                .dates(dates)
                .timeSlots(SlotCatalog.slots())
                .minDate(today.toString())
                .maxDate(last.toString())
                .build();
    }
}
