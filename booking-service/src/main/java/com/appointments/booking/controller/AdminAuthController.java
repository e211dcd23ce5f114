package com.appointments.booking.controller;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.service.AdminAuthService;
import com.appointments.booking.web.HtmlPages;
import com.appointments.booking.web.RequestBodyReader;
import com.appointments.booking.web.SessionCookies;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

@Controller
@Slf4j
public class AdminAuthController {

    private static final MediaType TEXT_HTML_UTF8 = new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8);
    private static final String ADMIN_PAGE = "admin.html";

    private final AdminAuthService adminAuthService;
    private final RequestBodyReader requestBodyReader;
    private final HtmlPages htmlPages;
    private final Resource adminPage;

    public AdminAuthController(
            AdminAuthService adminAuthService,
            RequestBodyReader requestBodyReader,
            HtmlPages htmlPages,
            ResourceLoader resourceLoader,
            @Value("${booking.static-location:classpath:/static/}") String staticLocation) {
        this.adminAuthService = adminAuthService;
        this.requestBodyReader = requestBodyReader;
        this.htmlPages = htmlPages;
        this.adminPage = resourceLoader.getResource(
                (staticLocation.endsWith("/") ? staticLocation : staticLocation + "/") + ADMIN_PAGE);
    }

    @GetMapping(BookingConstants.ADMIN_PATH)
    public ResponseEntity<?> adminPanel(HttpServletRequest request) throws IOException {
        if (!adminAuthService.isAuthenticated(SessionCookies.readToken(request))) {
            return redirect(BookingConstants.ADMIN_LOGIN_PATH).build();
        }
        if (!adminPage.exists()) {
            log.error("Admin page not found at {}", adminPage);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .contentType(TEXT_HTML_UTF8)
                .body(adminPage.getContentAsString(StandardCharsets.UTF_8));
    }

    @GetMapping(BookingConstants.ADMIN_LOGIN_PATH)
    public ResponseEntity<String> loginPage(HttpServletRequest request) {
        if (adminAuthService.isAuthenticated(SessionCookies.readToken(request))) {
            return redirect(BookingConstants.ADMIN_PATH).build();
        }
        return ResponseEntity.ok().contentType(TEXT_HTML_UTF8).body(htmlPages.login(null));
    }

    @PostMapping(BookingConstants.ADMIN_LOGIN_PATH)
    public ResponseEntity<String> login(HttpServletRequest request) throws IOException {
        Map<String, String> fields = requestBodyReader.read(request);
        Optional<String> token = adminAuthService.login(fields.get("username"), fields.get("password"));

        if (token.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .contentType(TEXT_HTML_UTF8)
                    .body(htmlPages.login("Credenziali non valide."));
        }

        return redirect(BookingConstants.ADMIN_PATH)
                .header(HttpHeaders.SET_COOKIE, SessionCookies.issue(token.get()).toString())
                .build();
    }

    @GetMapping("/admin/logout")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        adminAuthService.logout(SessionCookies.readToken(request));
        return redirect(BookingConstants.ADMIN_LOGIN_PATH)
                .header(HttpHeaders.SET_COOKIE, SessionCookies.expire().toString())
                .build();
    }

    private static ResponseEntity.BodyBuilder redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location));
    }
}
