package com.appointments.booking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingEntry {

    Long id;

    @JsonProperty("nome")
    String firstName;

    @JsonProperty("cognome")
    String lastName;

    @JsonProperty("telefono")
    String phone;

    String email;

    @JsonProperty("data_ora")
    String dateTime;

    @JsonProperty("data")
    String date;

    @JsonProperty("ora")
    String time;

    String note;
    String status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("canceled_at")
    Instant canceledAt;

    boolean attended;
    boolean paid;

    @JsonProperty("thanked_at")
    Instant thankedAt;
}
