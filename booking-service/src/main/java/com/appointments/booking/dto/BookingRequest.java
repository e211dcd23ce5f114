package com.appointments.booking.dto;

import com.appointments.booking.constants.ValidationMessages;
import com.appointments.booking.util.FormValues;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.Map;

/**
 * Booking fields as submitted by the public form or the admin panel, already trimmed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingRequest {

    @NotBlank(message = ValidationMessages.FIRST_NAME_REQUIRED)
    String firstName;

    @NotBlank(message = ValidationMessages.LAST_NAME_REQUIRED)
    String lastName;

    @NotBlank(message = ValidationMessages.PHONE_REQUIRED)
    String phone;

    @NotBlank(message = ValidationMessages.EMAIL_REQUIRED)
    String email;

    @NotBlank(message = ValidationMessages.DATE_REQUIRED)
    String date;

    @NotBlank(message = ValidationMessages.TIME_REQUIRED)
    String time;

    @Builder.Default
    String note = "";

    String privacy;

    public static BookingRequest fromFields(Map<String, String> fields) {
        String note = FormValues.trimmed(fields.get("note"));
        return BookingRequest.builder()
                .firstName(FormValues.trimmed(fields.get("nome")))
                .lastName(FormValues.trimmed(fields.get("cognome")))
                .phone(FormValues.trimmed(fields.get("telefono")))
                .email(FormValues.trimmed(fields.get("email")))
                .date(FormValues.trimmed(fields.get("data")))
                .time(FormValues.trimmed(fields.get("ora")))
                .note(note == null ? "" : note)
                .privacy(FormValues.trimmed(fields.get("privacy")))
                .build();
    }
}
