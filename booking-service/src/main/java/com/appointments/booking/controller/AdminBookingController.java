package com.appointments.booking.controller;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.dto.BookingConfirmation;
import com.appointments.booking.dto.BookingEntry;
import com.appointments.booking.dto.BookingRequest;
import com.appointments.booking.dto.BookingUpdateResult;
import com.appointments.booking.mapper.BookingMapper;
import com.appointments.booking.service.BookingOrchestrator;
import com.appointments.booking.service.BookingService;
import com.appointments.booking.util.FormValues;
import com.appointments.booking.web.PublicUrlResolver;
import com.appointments.booking.web.RequestBodyReader;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Admin panel API. Session checks happen in {@link com.appointments.booking.web.AdminSessionFilter}.
 */
@RestController
@RequestMapping(BookingConstants.ADMIN_API_PATH)
@RequiredArgsConstructor
@Slf4j
public class AdminBookingController {

    private final BookingService bookingService;
    private final BookingOrchestrator bookingOrchestrator;
    private final BookingMapper bookingMapper;
    private final RequestBodyReader requestBodyReader;
    private final PublicUrlResolver publicUrlResolver;

    @GetMapping
    public ResponseEntity<Map<String, List<BookingEntry>>> list() {
        log.debug("GET /api/bookings");
        return ResponseEntity.ok(Map.of("bookings", bookingMapper.toEntries(bookingService.list())));
    }

    @PostMapping("/create")
    public ResponseEntity<Map<String, Object>> create(HttpServletRequest request) throws IOException {
        Map<String, String> fields = requestBodyReader.read(request);
        log.info("POST /api/bookings/create - date={}, time={}", fields.get("data"), fields.get("ora"));

        BookingConfirmation confirmation = bookingOrchestrator.book(
                BookingRequest.fromFields(fields), false, publicUrlResolver.baseUrl(request));

        return ResponseEntity.ok(Map.of(
                "booking", bookingMapper.toEntry(confirmation.booking()),
                "confirmation_email", Map.of("sent", confirmation.emailSent())));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, BookingEntry>> cancel(HttpServletRequest request) throws IOException {
        Long id = FormValues.parseId(requestBodyReader.read(request).get("id"));
        log.info("POST /api/bookings/cancel - id={}", id);

        return ResponseEntity.ok(Map.of("booking", bookingMapper.toEntry(bookingService.cancelById(id).booking())));
    }

    @PostMapping("/delete")
    public ResponseEntity<Map<String, Object>> delete(HttpServletRequest request) throws IOException {
        Long id = FormValues.parseId(requestBodyReader.read(request).get("id"));
        log.info("POST /api/bookings/delete - id={}", id);

        bookingService.deleteById(id);
        return ResponseEntity.ok(Map.of("deleted", true, "id", id));
    }

    @PostMapping("/update")
    public ResponseEntity<Map<String, Object>> update(HttpServletRequest request) throws IOException {
        Map<String, String> fields = requestBodyReader.read(request);
        Long id = FormValues.parseId(fields.get("id"));
        Boolean attended = FormValues.parseFlag("attended", fields.get("attended")).orElse(null);
        Boolean paid = FormValues.parseFlag("paid", fields.get("paid")).orElse(null);
        log.info("POST /api/bookings/update - id={}, attended={}, paid={}", id, attended, paid);

        BookingUpdateResult result = bookingOrchestrator.update(id, attended, paid);
        return ResponseEntity.ok(Map.of(
                "booking", bookingMapper.toEntry(result.booking()),
                "thank_you_email", Map.of("sent", result.thankYouSent())));
    }
}
