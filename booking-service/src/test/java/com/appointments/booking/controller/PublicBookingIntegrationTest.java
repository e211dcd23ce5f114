package com.appointments.booking.controller;

import com.appointments.booking.enums.BookingStatus;
import com.appointments.booking.model.Booking;
import com.appointments.booking.support.AbstractSqliteIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Public booking flow")
class PublicBookingIntegrationTest extends AbstractSqliteIntegrationTest {

    private ResultActions submit(String date, String time) throws Exception {
        return mockMvc.perform(post("/prenota")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("nome", " Mario ")
                .param("cognome", "Rossi")
                .param("telefono", "3331234567")
                .param("email", "mario@example.com")
                .param("data", date)
                .param("ora", time)
                .param("privacy", "on"));
    }

    private Booking onlyBooking() {
        assertThat(bookingRepository.findAll()).hasSize(1);
        return bookingRepository.findAll().get(0);
    }

    @Nested
    @DisplayName("POST /prenota")
    class BookTests {

        @Test
        @DisplayName("Should store the booking and answer with a confirmation page")
        void book_Valid_Confirmation() throws Exception {
            String date = daysFromToday(3);

            submit(date, "09:00")
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                    .andExpect(content().string(containsString("Grazie, Mario Rossi.")))
                    .andExpect(content().string(containsString(date + " 09:00")));

            Booking booking = onlyBooking();
            assertThat(booking.getFirstName()).isEqualTo("Mario");
            assertThat(booking.getStatus()).isEqualTo(BookingStatus.BOOKED);
            assertThat(booking.getToken()).isNotBlank();
            verify(notificationSender).sendConfirmation(any(), startsWith("http://localhost:8000/annulla?token="));
        }

        @Test
        @DisplayName("Should accept a JSON body")
        void book_Json_Confirmation() throws Exception {
            String body = """
                    {"nome": "Anna", "cognome": "Neri", "telefono": "1", "email": "anna@example.com",
                     "data": "%s", "ora": "14:30", "privacy": true}
                    """.formatted(daysFromToday(1));

            mockMvc.perform(post("/prenota").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isOk());

            assertThat(onlyBooking().getBookingTime()).isEqualTo("14:30");
        }

        @Test
        @DisplayName("Should reject a request without privacy consent")
        void book_MissingPrivacy_BadRequest() throws Exception {
            mockMvc.perform(post("/prenota")
                            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                            .param("nome", "Mario")
                            .param("cognome", "Rossi")
                            .param("telefono", "3331234567")
                            .param("email", "mario@example.com")
                            .param("data", daysFromToday(3))
                            .param("ora", "09:00"))
                    .andExpect(status().isBadRequest())
                    .andExpect(content().string(containsString("Dati mancanti")));

            assertThat(bookingRepository.count()).isZero();
        }

        @Test
        @DisplayName("Should reject dates outside the booking window")
        void book_OutOfRange_BadRequest() throws Exception {
            submit(daysFromToday(60), "09:00")
                    .andExpect(status().isBadRequest())
                    .andExpect(content().string(containsString("Data fuori intervallo")));
            submit(daysFromToday(-1), "09:00")
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should reject a time outside the catalog")
        void book_InvalidSlot_BadRequest() throws Exception {
            submit(daysFromToday(2), "12:00")
                    .andExpect(status().isBadRequest())
                    .andExpect(content().string(containsString("Orario non valido")));
        }

        @Test
        @DisplayName("Should report a taken slot as a conflict until it is canceled")
        void book_TakenSlot_ConflictThenFreedByCancel() throws Exception {
            String date = daysFromToday(5);
            submit(date, "10:00").andExpect(status().isOk());

            submit(date, "10:00")
                    .andExpect(status().isConflict())
                    .andExpect(content().string(containsString("Slot non disponibile")));

            String token = onlyBooking().getToken();
            mockMvc.perform(get("/annulla").param("token", token))
                    .andExpect(status().isOk());

            submit(date, "10:00").andExpect(status().isOk());
            assertThat(bookingRepository.count()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("GET /annulla")
    class CancelTests {

        @Test
        @DisplayName("Should cancel once and keep the first cancellation time")
        void cancel_Twice_Idempotent() throws Exception {
            submit(daysFromToday(4), "11:00").andExpect(status().isOk());
            String token = onlyBooking().getToken();

            mockMvc.perform(get("/annulla").param("token", token))
                    .andExpect(status().isOk())
                    .andExpect(content().string(containsString("Prenotazione annullata")));
            Instant firstCancel = onlyBooking().getCanceledAt();

            mockMvc.perform(get("/annulla").param("token", token))
                    .andExpect(status().isOk())
                    .andExpect(content().string(containsString("Prenotazione gia annullata")));

            Booking booking = onlyBooking();
            assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELED);
            assertThat(booking.getCanceledAt()).isEqualTo(firstCancel);
        }

        @Test
        @DisplayName("Should answer 400 without a token")
        void cancel_NoToken_BadRequest() throws Exception {
            mockMvc.perform(get("/annulla"))
                    .andExpect(status().isBadRequest())
                    .andExpect(content().string(containsString("Token mancante")));
        }

        @Test
        @DisplayName("Should answer 404 for an unknown token")
        void cancel_UnknownToken_NotFound() throws Exception {
            mockMvc.perform(get("/annulla").param("token", "does-not-exist"))
                    .andExpect(status().isNotFound())
                    .andExpect(content().string(containsString("Token non valido")));
        }
    }

    @Nested
    @DisplayName("GET /api/availability")
    class AvailabilityTests {

        @Test
        @DisplayName("Should hide booked slots and show them again after cancellation")
        void availability_ReflectsBookings() throws Exception {
            String date = daysFromToday(2);
            submit(date, "15:30").andExpect(status().isOk());

            mockMvc.perform(get("/api/availability"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.dates", hasSize(60)))
                    .andExpect(jsonPath("$.timeSlots", hasSize(13)))
                    .andExpect(jsonPath("$.minDate").value(daysFromToday(0)))
                    .andExpect(jsonPath("$.maxDate").value(daysFromToday(59)))
                    .andExpect(jsonPath("$.dates[2].date").value(date))
                    .andExpect(jsonPath("$.dates[2].available", hasSize(12)))
                    .andExpect(jsonPath("$.dates[2].available", not(hasItem("15:30"))));

            mockMvc.perform(get("/annulla").param("token", onlyBooking().getToken()))
                    .andExpect(status().isOk());

            mockMvc.perform(get("/api/availability"))
                    .andExpect(jsonPath("$.dates[2].available", hasSize(13)))
                    .andExpect(jsonPath("$.dates[2].available", hasItem("15:30")));
        }
    }
}
