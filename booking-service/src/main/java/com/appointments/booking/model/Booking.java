package com.appointments.booking.model;

import com.appointments.booking.enums.BookingStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.Instant;

@Entity
@Table(name = "bookings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    Long id;

    @Column(name = "nome", nullable = false)
    String firstName;

    @Column(name = "cognome", nullable = false)
    String lastName;

    @Column(name = "telefono", nullable = false)
    String phone;

    @Column(name = "email", nullable = false)
    String email;

    // Written for older readers of the table; date and time columns are authoritative.
    @Column(name = "data_ora")
    String legacyDateTime;

    @Column(name = "data")
    String bookingDate;

    @Column(name = "ora")
    String bookingTime;

    @Column(name = "note")
    @Builder.Default
    String note = "";

    @Convert(converter = BookingStatusConverter.class)
    @Column(name = "status")
    @Builder.Default
    BookingStatus status = BookingStatus.BOOKED;

    @Column(name = "token", updatable = false)
    String token;

    @Convert(converter = InstantStringConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    Instant createdAt;

    @Convert(converter = InstantStringConverter.class)
    @Column(name = "canceled_at")
    Instant canceledAt;

    @Column(name = "attended", nullable = false)
    boolean attended;

    @Column(name = "paid", nullable = false)
    boolean paid;

    @Convert(converter = InstantStringConverter.class)
    @Column(name = "thanked_at")
    Instant thankedAt;

    public boolean isCanceled() {
        return status == BookingStatus.CANCELED;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    /**
     * Date and time as shown to people; rows predating the split columns fall back to the stored value.
     */
    public String getDisplayDateTime() {
        if (bookingDate != null && bookingTime != null) {
            return bookingDate + " " + bookingTime;
        }
        return legacyDateTime;
    }
}
