package com.appointments.booking.controller;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.dto.BookingConfirmation;
import com.appointments.booking.dto.BookingRequest;
import com.appointments.booking.dto.CancellationResult;
import com.appointments.booking.exception.BookingException;
import com.appointments.booking.service.BookingOrchestrator;
import com.appointments.booking.service.BookingService;
import com.appointments.booking.web.HtmlPages;
import com.appointments.booking.web.PublicUrlResolver;
import com.appointments.booking.web.RequestBodyReader;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Visitor-facing booking and cancellation. Answers in HTML, errors included.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class PublicBookingController {

    private static final MediaType TEXT_HTML_UTF8 = new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8);

    private final BookingOrchestrator bookingOrchestrator;
    private final BookingService bookingService;
    private final RequestBodyReader requestBodyReader;
    private final PublicUrlResolver publicUrlResolver;
    private final HtmlPages htmlPages;

    @PostMapping("/prenota")
    public ResponseEntity<String> book(HttpServletRequest request) throws IOException {
        Map<String, String> fields = requestBodyReader.read(request);
        log.info("POST /prenota - date={}, time={}", fields.get("data"), fields.get("ora"));

        BookingConfirmation confirmation = bookingOrchestrator.book(
                BookingRequest.fromFields(fields), true, publicUrlResolver.baseUrl(request));

        return html(ResponseEntity.ok(),
                htmlPages.confirmation(confirmation.booking(), confirmation.emailOutcome()));
    }

    @GetMapping(BookingConstants.CANCEL_PATH)
    public ResponseEntity<String> cancel(@RequestParam(value = "token", required = false) String token) {
        log.info("GET {} - token={}", BookingConstants.CANCEL_PATH, token != null ? "[present]" : "[absent]");

        CancellationResult result = bookingService.cancelByToken(token);
        return html(ResponseEntity.ok(), htmlPages.cancellation(result.alreadyCanceled()));
    }

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<String> handleBookingException(BookingException ex) {
        log.warn("Public request rejected: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        return html(ResponseEntity.status(ex.getStatus()), htmlPages.error(ex.getErrorCode(), ex.getMessage()));
    }

    private static ResponseEntity<String> html(ResponseEntity.BodyBuilder builder, String body) {
        return builder.contentType(TEXT_HTML_UTF8).body(body);
    }
}
