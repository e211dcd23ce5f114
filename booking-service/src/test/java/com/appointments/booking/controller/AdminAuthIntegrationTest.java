package com.appointments.booking.controller;

import com.appointments.booking.constants.BookingConstants;
import com.appointments.booking.model.Booking;
import com.appointments.booking.support.AbstractSqliteIntegrationTest;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.net.URI;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Admin login and session gate")
class AdminAuthIntegrationTest extends AbstractSqliteIntegrationTest {

    @Test
    @DisplayName("Should set an HttpOnly session cookie and redirect to the panel")
    void login_ValidCredentials_SetsCookie() throws Exception {
        MvcResult result = mockMvc.perform(post(BookingConstants.ADMIN_LOGIN_PATH)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", ADMIN_USER)
                        .param("password", ADMIN_PASSWORD))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl(BookingConstants.ADMIN_PATH))
                .andReturn();

        String setCookie = result.getResponse().getHeader(HttpHeaders.SET_COOKIE);
        assertThat(setCookie)
                .startsWith(BookingConstants.SESSION_COOKIE + "=")
                .contains("HttpOnly")
                .contains("Path=/")
                .contains("SameSite=Lax");
    }

    @Test
    @DisplayName("Should answer 401 with the login page for wrong credentials")
    void login_WrongPassword_Unauthorized() throws Exception {
        mockMvc.perform(post(BookingConstants.ADMIN_LOGIN_PATH)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", ADMIN_USER)
                        .param("password", "wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().doesNotExist(HttpHeaders.SET_COOKIE))
                .andExpect(content().string(containsString("Credenziali non valide.")));
    }

    @Test
    @DisplayName("Should reject every admin API route without a session, whatever the payload")
    void adminApi_NoSession_Unauthorized() throws Exception {
        mockMvc.perform(get("/api/bookings"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        for (String action : new String[]{"create", "cancel", "delete", "update"}) {
            mockMvc.perform(post("/api/bookings/" + action)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{not json"))
                    .andExpect(status().isUnauthorized());
        }

        mockMvc.perform(get("/api/bookings").cookie(new Cookie(BookingConstants.SESSION_COOKIE, "forged")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should guard admin API paths written with path parameters or percent-encoding")
    void adminApi_EquivalentPaths_Unauthorized() throws Exception {
        Booking booking = bookingRepository.save(Booking.builder()
                .firstName("Anna")
                .lastName("Neri")
                .phone("3330000000")
                .email("anna@example.com")
                .bookingDate(daysFromToday(2))
                .bookingTime("09:00")
                .token("equivalent-path-token")
                .createdAt(Instant.now())
                .build());

        for (String path : new String[]{"/api/bookings;x=1", "/api/%62ookings", "/api/bookings/"}) {
            mockMvc.perform(get(URI.create(path)))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        }

        mockMvc.perform(post(URI.create("/api/bookings;x=1/delete"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": " + booking.getId() + "}"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post(URI.create("/api/%62ookings/cancel"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": " + booking.getId() + "}"))
                .andExpect(status().isUnauthorized());

        assertThat(bookingRepository.findById(booking.getId()))
                .get()
                .satisfies(stored -> assertThat(stored.isCanceled()).isFalse());
    }

    @Test
    @DisplayName("Should redirect the panel to the login page until logged in")
    void adminPanel_RequiresSession() throws Exception {
        mockMvc.perform(get(BookingConstants.ADMIN_PATH))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl(BookingConstants.ADMIN_LOGIN_PATH));

        Cookie session = loginAsAdmin();

        mockMvc.perform(get(BookingConstants.ADMIN_PATH).cookie(session))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML));
    }

    @Test
    @DisplayName("Should end the session on logout")
    void logout_RevokesSession() throws Exception {
        Cookie session = loginAsAdmin();
        mockMvc.perform(get("/api/bookings").cookie(session))
                .andExpect(status().isOk());

        mockMvc.perform(get("/admin/logout").cookie(session))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl(BookingConstants.ADMIN_LOGIN_PATH))
                .andExpect(header().string(HttpHeaders.SET_COOKIE, containsString("Max-Age=0")));

        mockMvc.perform(get("/api/bookings").cookie(session))
                .andExpect(status().isUnauthorized());
    }
}
